package com.blueprintprobe.config;

import com.blueprintprobe.extract.AnnotationMacros;
import com.blueprintprobe.extract.CommentStripper;
import com.blueprintprobe.source.SourceDocument;

import java.util.List;

/**
 * Scrapes {@code \home}, {@code \github} and {@code \dochome} from blueprint sources.
 * Later declarations win, both within one document and across documents.
 */
public class ConfigScraper {

    public BlueprintConfig scrape(List<SourceDocument> documents) {
        BlueprintConfig merged = new BlueprintConfig();
        for (SourceDocument document : documents) {
            merged.mergeFrom(scrape(document.text()));
        }
        return merged;
    }

    public BlueprintConfig scrape(String text) {
        String stripped = CommentStripper.strip(text);
        BlueprintConfig config = new BlueprintConfig();
        config.setHome(last(stripped, "home"));
        config.setGithub(last(stripped, "github"));
        config.setDochome(last(stripped, "dochome"));
        return config;
    }

    private static String last(String text, String macro) {
        List<String> values = AnnotationMacros.arguments(text, macro);
        for (int i = values.size() - 1; i >= 0; i--) {
            String value = values.get(i).trim();
            if (!value.isEmpty()) return value;
        }
        return null;
    }
}
