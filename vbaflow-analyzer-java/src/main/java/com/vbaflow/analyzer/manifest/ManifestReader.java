package com.vbaflow.analyzer.manifest;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;

public class ManifestReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes an analysis manifest from the given path.
     *
     * @throws ManifestReadException if the file is missing, malformed or names an unknown encoding
     */
    public ManifestConfig read(Path manifestPath) {
        if (!Files.isRegularFile(manifestPath)) {
            throw new ManifestReadException("Manifest file not found: " + manifestPath);
        }
        ManifestConfig config;
        try (Reader reader = Files.newBufferedReader(manifestPath, StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, ManifestConfig.class);
        } catch (JsonParseException e) {
            throw new ManifestReadException("Manifest is not valid JSON: " + manifestPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ManifestReadException("Failed to read manifest: " + manifestPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ManifestReadException("Manifest file is empty or invalid JSON: " + manifestPath);
        }
        try {
            config.getCharset();
        } catch (UnsupportedCharsetException | IllegalCharsetNameException e) {
            throw new ManifestReadException("Unknown module encoding in manifest: " + config.getEncoding(), e);
        }
        return config;
    }

    public static class ManifestReadException extends RuntimeException {
        public ManifestReadException(String message) { super(message); }
        public ManifestReadException(String message, Throwable cause) { super(message, cause); }
    }
}
