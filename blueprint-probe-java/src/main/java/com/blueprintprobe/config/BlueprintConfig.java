package com.blueprintprobe.config;

import com.google.gson.annotations.SerializedName;

/**
 * Project links declared in the blueprint sources. Unset keys stay null and are left out of config.json.
 */
public class BlueprintConfig {

    @SerializedName("home")
    private String home;

    @SerializedName("github")
    private String github;

    @SerializedName("dochome")
    private String dochome;

    public String getHome()    { return home; }
    public String getGithub()  { return github; }
    public String getDochome() { return dochome; }

    void setHome(String home)       { this.home = home; }
    void setGithub(String github)   { this.github = github; }
    void setDochome(String dochome) { this.dochome = dochome; }

    public boolean isEmpty() {
        return home == null && github == null && dochome == null;
    }

    /** Copies every key {@code later} sets over this one. */
    public void mergeFrom(BlueprintConfig later) {
        if (later.home != null)    home = later.home;
        if (later.github != null)  github = later.github;
        if (later.dochome != null) dochome = later.dochome;
    }
}
