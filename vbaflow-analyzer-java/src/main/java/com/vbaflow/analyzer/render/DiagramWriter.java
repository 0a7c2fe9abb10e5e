package com.vbaflow.analyzer.render;

import com.vbaflow.analyzer.ir.CfgModel.CallGraph;
import com.vbaflow.analyzer.ir.CfgModel.CfgDocument;
import com.vbaflow.analyzer.ir.CfgSerializer.SerializerException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes rendered diagrams as {@code .mmd} files:
 * {@code <module>.<procedure>.mmd} per procedure and {@code <module>.callgraph.mmd}. Procedures
 * sharing a name are told apart by kind, e.g. {@code Counter.Count.PropertyLet.mmd}.
 */
public class DiagramWriter {

    private final MermaidRenderer renderer;

    public DiagramWriter(MermaidRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * @return paths written, procedures first, call graph last
     */
    public List<Path> write(CfgDocument doc, Path outputDir) {
        Map<String, String> diagrams = renderer.renderDocument(doc);
        createDirectories(outputDir);

        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, String> e : diagrams.entrySet()) {
            Path path = outputDir.resolve(doc.moduleName + "." + e.getKey() + ".mmd");
            writeText(e.getValue(), path);
            written.add(path);
        }
        if (doc.callGraph != null) {
            Path path = outputDir.resolve(doc.moduleName + ".callgraph.mmd");
            writeText(renderer.renderCallGraph(doc.callGraph), path);
            written.add(path);
        }
        System.err.println("[vba-flow] " + written.size() + " diagrams written to " + outputDir);
        return written;
    }

    public Path writeProjectCallGraph(CallGraph graph, Path outputDir) {
        createDirectories(outputDir);
        Path path = outputDir.resolve("project.callgraph.mmd");
        writeText(renderer.renderCallGraph(graph), path);
        System.err.println("[vba-flow] project.callgraph.mmd written: " + path);
        return path;
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + dir, e);
        }
    }

    private static void writeText(String text, Path path) {
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + path, e);
        }
    }
}
