package com.vbaflow.analyzer.static_analysis;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scans every module file of a project folder and records the procedures each one declares.
 */
public class SymbolTableBuilder {

    public static class DirectoryNotFoundException extends RuntimeException {
        public DirectoryNotFoundException(Path dir) {
            super("Directory not found: " + dir);
        }
    }

    /** Per-file scan result, merged serially into the table. */
    record ModuleSymbols(String moduleName, Set<String> procedures) {}

    private final Set<String> extensions;
    private final Charset charset;

    public SymbolTableBuilder(Collection<String> extensions, Charset charset) {
        this.extensions = extensions.stream()
            .map(e -> e.toLowerCase(Locale.ROOT))
            .map(e -> e.startsWith(".") ? e : "." + e)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        this.charset = charset;
    }

    /**
     * Build the symbol table for all module files directly under {@code dir}.
     *
     * @throws DirectoryNotFoundException if {@code dir} does not exist or is not a directory
     */
    public SymbolTable build(Path dir) {
        List<Path> files = listModuleFiles(dir);

        // Each file is a pure function of its content; scan in parallel, merge in file order
        List<ModuleSymbols> scanned = files.parallelStream()
            .map(this::scan)
            .collect(Collectors.toList());

        SymbolTable table = new SymbolTable();
        for (ModuleSymbols symbols : scanned) {
            table.add(symbols.moduleName(), symbols.procedures());
        }
        System.err.println("[vba-flow] Symbol table built: " + table.size() + " modules from " + dir);
        return table;
    }

    /**
     * Module files directly under {@code dir} with a recognized extension, sorted by name.
     */
    public List<Path> listModuleFiles(Path dir) {
        if (dir == null || !Files.isDirectory(dir)) {
            throw new DirectoryNotFoundException(dir);
        }
        try (Stream<Path> list = Files.list(dir)) {
            return list
                .filter(Files::isRegularFile)
                .filter(this::hasRecognizedExtension)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list module folder " + dir + ": " + e.getMessage(), e);
        }
    }

    ModuleSymbols scan(Path file) {
        ModuleSource source;
        try {
            source = ModuleSource.read(file, charset);
        } catch (UncheckedIOException | ModuleFileNotFoundException e) {
            System.err.println("[vba-flow] WARNING: unreadable module, no symbols recorded: "
                + file + " (" + e.getMessage() + ")");
            return new ModuleSymbols(ModuleSource.baseName(file), Collections.emptySet());
        }
        return new ModuleSymbols(source.moduleName(), declaredProcedures(source.lines()));
    }

    /**
     * Names of all procedure headers among {@code lines}, in declaration order.
     */
    public static Set<String> declaredProcedures(List<LogicalLine> lines) {
        Set<String> names = new LinkedHashSet<>();
        for (LogicalLine line : lines) {
            ProcedureHeader.match(line.code()).ifPresent(h -> names.add(h.name()));
        }
        return names;
    }

    private boolean hasRecognizedExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (name.endsWith(ext)) return true;
        }
        return false;
    }
}
