package com.vbaflow.analyzer.static_analysis;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * One exported module file: its declared name and normalized statement lines.
 */
public record ModuleSource(
    Path path,
    String moduleName,
    List<String> rawLines,
    List<LogicalLine> lines
) {

    private static final LineNormalizer NORMALIZER = new LineNormalizer();

    /**
     * Reads and normalizes a module file.
     *
     * @throws ModuleFileNotFoundException if {@code path} is not a regular file
     * @throws UncheckedIOException        if the file cannot be read or decoded
     */
    public static ModuleSource read(Path path, Charset charset) {
        if (!Files.isRegularFile(path)) {
            throw new ModuleFileNotFoundException(path);
        }
        String text;
        try {
            text = Files.readString(path, charset);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read module " + path + ": " + e.getMessage(), e);
        }
        return fromText(path, text);
    }

    public static ModuleSource fromText(Path path, String text) {
        List<String> raw = LineNormalizer.splitLines(stripBom(text));
        List<LogicalLine> lines = NORMALIZER.normalize(raw);
        return new ModuleSource(path, declaredName(lines).orElse(baseName(path)), raw, lines);
    }

    /**
     * Module name from the {@code Attribute VB_Name} header, if present.
     */
    static Optional<String> declaredName(List<LogicalLine> lines) {
        for (LogicalLine line : lines) {
            Optional<String> name = ProcedureHeader.moduleNameAttribute(line.code());
            if (name.isPresent()) return name;
        }
        return Optional.empty();
    }

    /** "C:/export/Module1.bas" -> "Module1" */
    public static String baseName(Path path) {
        if (path == null || path.getFileName() == null) return "Module";
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }
}
