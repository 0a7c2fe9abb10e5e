package com.vbaflow.analyzer;

import com.vbaflow.analyzer.ir.CfgAssembler;
import com.vbaflow.analyzer.ir.CfgModel.CallGraph;
import com.vbaflow.analyzer.ir.CfgModel.CfgDocument;
import com.vbaflow.analyzer.ir.CfgReader;
import com.vbaflow.analyzer.ir.CfgSerializer;
import com.vbaflow.analyzer.manifest.ManifestConfig;
import com.vbaflow.analyzer.manifest.ManifestReader;
import com.vbaflow.analyzer.render.DiagramWriter;
import com.vbaflow.analyzer.render.MermaidRenderer;
import com.vbaflow.analyzer.static_analysis.StaticAnalyzer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for vba-flow.
 *
 * Usage:
 *   java -jar vbaflow-analyzer-java.jar analyze --target <module file>
 *     [--source-dir <dir>] [--output <dir>] [--manifest <manifest.json>]
 *   java -jar vbaflow-analyzer-java.jar project --source-dir <dir>
 *     [--output <dir>] [--manifest <manifest.json>]
 *   java -jar vbaflow-analyzer-java.jar render --document <module.cfg.json> [--output <dir>]
 */
public class AnalyzerMain {

    private static final String USAGE =
        "Usage: java -jar vbaflow-analyzer-java.jar "
        + "analyze --target <file> [--source-dir <dir>] [--output <dir>] [--manifest <path>] | "
        + "project --source-dir <dir> [--output <dir>] [--manifest <path>] | "
        + "render --document <cfg.json> [--output <dir>]";

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[vba-flow] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[vba-flow] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        switch (args[0]) {
            case "analyze" -> analyze(parseFlags(args, Set.of("--target", "--source-dir", "--output", "--manifest")));
            case "project" -> project(parseFlags(args, Set.of("--source-dir", "--output", "--manifest")));
            case "render"  -> render(parseFlags(args, Set.of("--document", "--output")));
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        }
    }

    private static void analyze(Map<String, String> flags) {
        ManifestConfig config = loadConfig(flags)
            .withTarget(flags.get("--target"))
            .withSourceDir(flags.get("--source-dir"))
            .withOutputDir(flags.get("--output"));
        if (config.getTarget() == null) throw new UsageException("--target is required");

        Path target = Paths.get(config.getTarget());
        Path sourceDir = config.getSourceDir() != null
            ? Paths.get(config.getSourceDir())
            : target.toAbsolutePath().getParent();
        Path output = Paths.get(config.getOutputDir());

        // 1. Symbol table, segmentation, CFG construction, assembly
        System.err.println("[vba-flow] Analyzing " + target + " against " + sourceDir);
        CfgDocument doc = new StaticAnalyzer(config).analyzeModule(target, sourceDir);

        // 2. Document + diagrams
        System.err.println("[vba-flow] Writing output to: " + output);
        new CfgSerializer().write(doc, output);
        newDiagramWriter(config).write(doc, output);
        System.err.println("[vba-flow] Done.");
    }

    private static void project(Map<String, String> flags) {
        ManifestConfig config = loadConfig(flags)
            .withSourceDir(flags.get("--source-dir"))
            .withOutputDir(flags.get("--output"));
        if (config.getSourceDir() == null) throw new UsageException("--source-dir is required");

        Path sourceDir = Paths.get(config.getSourceDir());
        Path output = Paths.get(config.getOutputDir());

        System.err.println("[vba-flow] Analyzing project " + sourceDir);
        List<CfgDocument> docs = new StaticAnalyzer(config).analyzeProject(sourceDir);

        CfgSerializer serializer = new CfgSerializer();
        DiagramWriter diagrams = newDiagramWriter(config);
        for (CfgDocument doc : docs) {
            serializer.write(doc, output);
            diagrams.write(doc, output);
        }
        CallGraph merged = new CfgAssembler().mergeCallGraphs(docs);
        diagrams.writeProjectCallGraph(merged, output);
        System.err.println("[vba-flow] Done: " + docs.size() + " modules.");
    }

    private static void render(Map<String, String> flags) {
        String document = flags.get("--document");
        if (document == null) throw new UsageException("--document is required");
        Path docPath = Paths.get(document);
        Path output = flags.containsKey("--output")
            ? Paths.get(flags.get("--output"))
            : docPath.toAbsolutePath().getParent();

        System.err.println("[vba-flow] Rendering " + docPath);
        CfgDocument doc = new CfgReader().read(docPath);
        newDiagramWriter(ManifestConfig.defaults()).write(doc, output);
        System.err.println("[vba-flow] Done.");
    }

    private static ManifestConfig loadConfig(Map<String, String> flags) {
        String manifest = flags.get("--manifest");
        if (manifest == null) return ManifestConfig.defaults();
        System.err.println("[vba-flow] Reading manifest: " + manifest);
        Path manifestPath = Paths.get(manifest);
        ManifestConfig config = new ManifestReader().read(manifestPath);

        // Module paths inside the manifest are relative to the manifest's folder
        Path base = manifestPath.toAbsolutePath().getParent();
        return config
            .withSourceDir(resolveAgainst(base, config.getSourceDir()))
            .withTarget(resolveAgainst(base, config.getTarget()));
    }

    private static String resolveAgainst(Path base, String path) {
        if (path == null) return null;
        return base.resolve(path).normalize().toString();
    }

    private static DiagramWriter newDiagramWriter(ManifestConfig config) {
        return new DiagramWriter(new MermaidRenderer(config.getFlowDirection(), config.getCallGraphDirection()));
    }

    private static Map<String, String> parseFlags(String[] args, Set<String> allowed) {
        Map<String, String> flags = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            String flag = args[i];
            if (!allowed.contains(flag)) {
                throw new UsageException("Unknown flag: " + flag);
            }
            flags.put(flag, requireNext(args, i++, flag));
        }
        return flags;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
