package com.blueprintprobe.graph;

import com.blueprintprobe.graph.StubModel.Stub;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes JSON documents produced by the tool.
 * Map keys are sorted before writing so identical input gives byte-identical output.
 */
public class StubSerializer {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg) { super(msg); }
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes the stub graph to {@code output} and each companion document to its path.
     * Either every file is written or none is.
     */
    public void write(Map<String, Stub> stubs, Path output, Map<Path, ?> companions) {
        Map<Path, Object> documents = new LinkedHashMap<>();
        documents.put(output, new TreeMap<>(stubs));
        documents.putAll(companions);
        writeAll(documents);
    }

    /** Writes a single document, creating parent directories as needed. */
    public void writeJson(Object value, Path output) {
        writeAll(Map.of(output, value));
    }

    /**
     * Serializes every document, stages each one in a temporary file beside its target, and
     * only then moves them into place. A failure before the move leaves no target touched.
     */
    void writeAll(Map<Path, ?> documents) {
        Map<Path, String> rendered = new LinkedHashMap<>();
        for (Map.Entry<Path, ?> entry : documents.entrySet()) {
            Path target = entry.getKey().toAbsolutePath();
            if (Files.isDirectory(target)) {
                throw new SerializerException("Failed to write " + target + ": target is a directory");
            }
            rendered.put(target, GSON.toJson(entry.getValue()));
        }

        Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            for (Map.Entry<Path, String> entry : rendered.entrySet()) {
                Path target = entry.getKey();
                Files.createDirectories(target.getParent());
                Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
                staged.put(target, temp);
                Files.writeString(temp, entry.getValue(), StandardCharsets.UTF_8);
            }
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                Files.move(entry.getValue(), entry.getKey(), StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            SerializerException failure = new SerializerException("Failed to write output: " + e.getMessage(), e);
            for (Path temp : staged.values()) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }
}
