package com.blueprintprobe.report;

import com.blueprintprobe.graph.StubModel.Stub;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class StubsReader {

    private static final Gson GSON = new Gson();
    private static final Type STUB_MAP = new TypeToken<Map<String, Stub>>() {}.getType();

    /**
     * Reads and deserializes a stubs.json written by stubify.
     *
     * @throws StubsReadException if the file is missing or malformed
     */
    public Map<String, Stub> read(Path stubsPath) {
        if (!Files.exists(stubsPath)) {
            throw new StubsReadException("Stubs file not found: " + stubsPath);
        }
        try (Reader reader = Files.newBufferedReader(stubsPath, StandardCharsets.UTF_8)) {
            Map<String, Stub> stubs = GSON.fromJson(reader, STUB_MAP);
            if (stubs == null) {
                throw new StubsReadException("Stubs file is empty or invalid JSON: " + stubsPath);
            }
            return stubs;
        } catch (JsonParseException e) {
            throw new StubsReadException("Stubs file is not valid JSON: " + stubsPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StubsReadException("Failed to read stubs: " + stubsPath + ": " + e.getMessage(), e);
        }
    }

    public static class StubsReadException extends RuntimeException {
        public StubsReadException(String message) { super(message); }
        public StubsReadException(String message, Throwable cause) { super(message, cause); }
    }
}
