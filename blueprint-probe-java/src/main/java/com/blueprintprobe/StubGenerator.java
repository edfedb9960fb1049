package com.blueprintprobe;

import com.blueprintprobe.config.BlueprintConfig;
import com.blueprintprobe.config.ConfigScraper;
import com.blueprintprobe.config.EnvironmentTypes;
import com.blueprintprobe.extract.DocumentParser;
import com.blueprintprobe.extract.ParsedDocument;
import com.blueprintprobe.graph.GraphAssembler;
import com.blueprintprobe.graph.StubModel.Stub;
import com.blueprintprobe.graph.StubSerializer;
import com.blueprintprobe.source.BlueprintSourceResolver;
import com.blueprintprobe.source.BlueprintSources;
import com.blueprintprobe.source.DocumentReader;
import com.blueprintprobe.source.SourceDocument;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Orchestrates a full stubify run: resolve sources, parse every document, assemble the graph.
 *
 * Documents are parsed in parallel; the ordered collect keeps traversal order, which the
 * sequential assembly stage depends on for label synthesis and duplicate reporting.
 */
public class StubGenerator {

    static final String CONFIG_FILE = "config.json";

    private final DocumentReader reader = new DocumentReader();
    private final ConfigScraper configScraper = new ConfigScraper();
    private final GraphAssembler assembler = new GraphAssembler();

    /** Stub graph and scraped project config of one project. */
    public record Result(Map<String, Stub> stubs, BlueprintConfig config) {}

    public Result generate(Path projectRoot) {
        BlueprintSources sources = new BlueprintSourceResolver().resolve(projectRoot);

        List<SourceDocument> allDocuments = new ArrayList<>();
        List<SourceDocument> contentDocuments = new ArrayList<>();
        SourceDocument webTex = null;
        Set<Path> contentFiles = new HashSet<>(sources.contentFiles());
        for (Path file : sources.allTexFiles()) {
            SourceDocument document = reader.read(sources.sourceDir(), file);
            allDocuments.add(document);
            if (contentFiles.contains(file)) {
                contentDocuments.add(document);
            } else if (file.equals(sources.webTex())) {
                webTex = document;
            }
        }

        List<String> types = webTex != null ? EnvironmentTypes.fromWebTex(webTex.text()) : EnvironmentTypes.DEFAULTS;
        System.err.println("[blueprint-probe] Looking for environments: " + String.join(", ", types));

        DocumentParser parser = new DocumentParser(types);
        List<ParsedDocument> parsed = contentDocuments.parallelStream()
                .map(parser::parse)
                .collect(Collectors.toList());
        for (ParsedDocument document : parsed) {
            for (String warning : document.warnings()) {
                System.err.println("[blueprint-probe] WARNING: " + warning);
            }
        }

        Map<String, Stub> stubs = assembler.assemble(parsed);
        System.err.println("[blueprint-probe] Found " + stubs.size() + " stubs in "
                + contentDocuments.size() + " documents");

        return new Result(stubs, configScraper.scrape(allDocuments));
    }

    /**
     * Generates the graph and writes it to {@code output}; {@code config.json} is written next to
     * it when the sources declare any project links. Nothing is written if generation fails.
     */
    public Result run(Path projectRoot, Path output) {
        Result result = generate(projectRoot);
        Map<Path, BlueprintConfig> companions = new LinkedHashMap<>();
        Path configPath = output.toAbsolutePath().resolveSibling(CONFIG_FILE);
        if (!result.config().isEmpty()) {
            companions.put(configPath, result.config());
        }
        new StubSerializer().write(result.stubs(), output, companions);
        System.err.println("[blueprint-probe] Wrote stubs to " + output);
        if (!companions.isEmpty()) {
            System.err.println("[blueprint-probe] Wrote config to " + configPath);
        }
        return result;
    }
}
