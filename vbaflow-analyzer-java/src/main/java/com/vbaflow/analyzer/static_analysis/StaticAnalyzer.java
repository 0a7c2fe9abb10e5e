package com.vbaflow.analyzer.static_analysis;

import com.vbaflow.analyzer.ir.CfgAssembler;
import com.vbaflow.analyzer.ir.CfgModel.CfgDocument;
import com.vbaflow.analyzer.ir.CfgModel.CfgProcedure;
import com.vbaflow.analyzer.manifest.ManifestConfig;
import com.vbaflow.analyzer.static_analysis.ProcedureSegmenter.ProcedureSlice;

import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrates one analysis run: symbol table over the project folder, then segmentation and
 * CFG construction for the target module(s), then assembly into CfgDocuments.
 */
public class StaticAnalyzer {

    private final List<String> extensions;
    private final Charset charset;
    private final ProcedureSegmenter segmenter = new ProcedureSegmenter();
    private final ControlFlowBuilder builder;
    private final CfgAssembler assembler = new CfgAssembler();

    public StaticAnalyzer(ManifestConfig config) {
        this.extensions = config.getExtensions();
        this.charset = config.getCharset();
        this.builder = new ControlFlowBuilder(new CallSiteDetector(config.getIgnoredCalls()));
    }

    /**
     * Graph every procedure of {@code target}, resolving calls against the modules in {@code sourceDir}.
     *
     * @throws SymbolTableBuilder.DirectoryNotFoundException if {@code sourceDir} does not exist
     * @throws ModuleFileNotFoundException                   if {@code target} does not exist
     */
    public CfgDocument analyzeModule(Path target, Path sourceDir) {
        // 1. Symbol table must be complete before any call is resolved
        SymbolTable table = newSymbolTableBuilder().build(sourceDir);

        // 2. Target module
        ModuleSource module = ModuleSource.read(target, charset);
        table.add(module.moduleName(), SymbolTableBuilder.declaredProcedures(module.lines()));

        return analyze(module, table);
    }

    /**
     * Graph every module in {@code sourceDir} against one shared symbol table.
     * Unreadable modules are skipped with a warning.
     */
    public List<CfgDocument> analyzeProject(Path sourceDir) {
        SymbolTableBuilder tableBuilder = newSymbolTableBuilder();
        SymbolTable table = tableBuilder.build(sourceDir);

        List<CfgDocument> documents = new ArrayList<>();
        for (Path file : tableBuilder.listModuleFiles(sourceDir)) {
            ModuleSource module;
            try {
                module = ModuleSource.read(file, charset);
            } catch (UncheckedIOException e) {
                System.err.println("[vba-flow] WARNING: skipping unreadable module " + file + ": " + e.getMessage());
                continue;
            }
            documents.add(analyze(module, table));
        }
        return documents;
    }

    CfgDocument analyze(ModuleSource module, SymbolTable table) {
        System.err.println("[vba-flow] Analyzing module " + module.moduleName() + " (" + module.path() + ")");
        List<ProcedureSlice> slices = segmenter.segment(module.lines());
        List<CfgProcedure> procedures = new ArrayList<>();
        for (ProcedureSlice slice : slices) {
            procedures.add(builder.build(slice, module.moduleName(), table));
        }
        return assembler.assemble(module.moduleName(), procedures);
    }

    private SymbolTableBuilder newSymbolTableBuilder() {
        return new SymbolTableBuilder(extensions, charset);
    }
}
