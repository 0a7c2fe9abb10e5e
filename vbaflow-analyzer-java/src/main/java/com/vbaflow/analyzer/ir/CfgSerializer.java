package com.vbaflow.analyzer.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.vbaflow.analyzer.ir.CfgModel.CallGraph;
import com.vbaflow.analyzer.ir.CfgModel.CallGraphEdge;
import com.vbaflow.analyzer.ir.CfgModel.CfgDocument;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Serializes a CfgDocument to {@code <module>.cfg.json}.
 * Call-graph arrays are sorted before writing so identical input yields identical output;
 * procedures, nodes and edges keep source order.
 */
public class CfgSerializer {

    static final String ANALYZER_VERSION = "0.1.0";

    static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code doc} to {@code outputDir/<module>.cfg.json}.
     * Also writes {@code outputDir/metadata.json} with module and analyzer info.
     *
     * @param doc       assembled document to write
     * @param outputDir directory to write into (created if absent)
     * @return path of the written document
     */
    public Path write(CfgDocument doc, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        Path docPath = outputDir.resolve(doc.moduleName + ".cfg.json");
        writeJson(toJson(doc), docPath);
        System.err.println("[vba-flow] " + docPath.getFileName() + " written: " + docPath);

        var meta = new Metadata(doc.moduleName, "vba", ANALYZER_VERSION,
                doc.procedures != null ? doc.procedures.size() : 0, Instant.now().toString());
        Path metaPath = outputDir.resolve("metadata.json");
        writeJson(GSON.toJson(meta), metaPath);
        System.err.println("[vba-flow] metadata.json written: " + metaPath);
        return docPath;
    }

    /**
     * Deterministic JSON form of {@code doc}. The call graph is sorted in place.
     */
    public String toJson(CfgDocument doc) {
        sortCallGraph(doc.callGraph);
        return GSON.toJson(doc);
    }

    static void sortCallGraph(CallGraph graph) {
        if (graph == null) return;
        if (graph.nodes != null) {
            graph.nodes = new ArrayList<>(graph.nodes);
            graph.nodes.sort(Comparator.naturalOrder());
        }
        if (graph.edges != null) {
            graph.edges = new ArrayList<>(graph.edges);
            graph.edges.sort(Comparator.comparing((CallGraphEdge e) -> e.from)
                    .thenComparing(e -> e.to)
                    .thenComparing(e -> e.resolved)
                    .thenComparingInt(e -> e.sourceLine));
        }
    }

    private void writeJson(String json, Path path) {
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            w.write(json);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /** Simple metadata record for Gson serialization. */
    private record Metadata(
            String moduleName,
            String language,
            String analyzerVersion,
            int procedureCount,
            String timestamp
    ) {}
}
