package com.vbaflow.analyzer.ir;

import com.google.gson.JsonParseException;
import com.vbaflow.analyzer.ir.CfgModel.CfgDocument;
import com.vbaflow.analyzer.ir.CfgModel.CfgNode;
import com.vbaflow.analyzer.ir.CfgModel.CfgProcedure;
import com.vbaflow.analyzer.static_analysis.ModuleFileNotFoundException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a previously written {@code .cfg.json} document back into the model.
 */
public class CfgReader {

    /**
     * @throws ModuleFileNotFoundException if {@code path} does not exist
     * @throws InvalidDocumentException    if the file is empty, not JSON, or structurally incomplete
     */
    public CfgDocument read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ModuleFileNotFoundException(path);
        }
        CfgDocument doc;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            doc = CfgSerializer.GSON.fromJson(reader, CfgDocument.class);
        } catch (JsonParseException e) {
            throw new InvalidDocumentException("Not a CFG document: " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new InvalidDocumentException("Failed to read CFG document: " + path + ": " + e.getMessage(), e);
        }
        validate(doc);
        return doc;
    }

    public CfgDocument fromJson(String json) {
        CfgDocument doc;
        try {
            doc = CfgSerializer.GSON.fromJson(json, CfgDocument.class);
        } catch (JsonParseException e) {
            throw new InvalidDocumentException("Not a CFG document: " + e.getMessage(), e);
        }
        validate(doc);
        return doc;
    }

    /**
     * Checks the parts every consumer relies on: module name, procedure list, and node ids and
     * types. Edge-level problems are not checked here; renderers skip offending edges.
     *
     * @throws InvalidDocumentException on the first structural problem found
     */
    public static void validate(CfgDocument doc) {
        if (doc == null) {
            throw new InvalidDocumentException("CFG document is missing");
        }
        if (doc.moduleName == null || doc.moduleName.isBlank()) {
            throw new InvalidDocumentException("CFG document has no module_name");
        }
        if (doc.procedures == null) {
            throw new InvalidDocumentException("CFG document for " + doc.moduleName + " has no procedures array");
        }
        for (CfgProcedure proc : doc.procedures) {
            if (proc == null || proc.name == null) {
                throw new InvalidDocumentException("Unnamed procedure in " + doc.moduleName);
            }
            if (proc.nodes == null || proc.edges == null) {
                throw new InvalidDocumentException("Procedure " + proc.name + " lacks nodes or edges");
            }
            for (CfgNode node : proc.nodes) {
                if (node == null || node.id == null || node.type == null) {
                    throw new InvalidDocumentException("Procedure " + proc.name + " has a node without id or type");
                }
            }
        }
    }
}
