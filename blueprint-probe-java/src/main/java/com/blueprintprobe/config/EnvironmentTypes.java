package com.blueprintprobe.config;

import com.blueprintprobe.extract.CommentStripper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statement environment names recognised by the extractor.
 *
 * A project may override the defaults in web.tex through the {@code thms} option of the
 * blueprint package, e.g. {@code &#92;usepackage[thms=dfn+lem+prop+thm+cor]{blueprint}}.
 */
public final class EnvironmentTypes {

    public static final List<String> DEFAULTS =
            List.of("definition", "lemma", "proposition", "theorem", "corollary");

    private static final Pattern BLUEPRINT_PACKAGE =
            Pattern.compile("\\\\usepackage\\s*\\[([^\\]]*)\\]\\s*\\{blueprint\\}");
    private static final Pattern THMS_OPTION = Pattern.compile("thms\\s*=\\s*([a-zA-Z+_]+)");

    private EnvironmentTypes() {}

    /** Environment names declared by {@code webTex}, or {@link #DEFAULTS} when none are declared. */
    public static List<String> fromWebTex(String webTex) {
        Matcher pkg = BLUEPRINT_PACKAGE.matcher(CommentStripper.strip(webTex));
        if (pkg.find()) {
            Matcher thms = THMS_OPTION.matcher(pkg.group(1));
            if (thms.find()) {
                List<String> types = new ArrayList<>();
                for (String token : thms.group(1).split("\\+")) {
                    String type = token.trim();
                    if (!type.isEmpty()) types.add(type);
                }
                if (!types.isEmpty()) return types;
            }
        }
        return DEFAULTS;
    }
}
