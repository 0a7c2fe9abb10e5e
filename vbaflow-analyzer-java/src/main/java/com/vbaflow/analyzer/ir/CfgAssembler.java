package com.vbaflow.analyzer.ir;

import com.vbaflow.analyzer.ir.CfgModel.CallGraph;
import com.vbaflow.analyzer.ir.CfgModel.CallGraphEdge;
import com.vbaflow.analyzer.ir.CfgModel.CallSite;
import com.vbaflow.analyzer.ir.CfgModel.CfgDocument;
import com.vbaflow.analyzer.ir.CfgModel.CfgProcedure;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregates per-procedure graphs into one document and folds their call sites into a
 * call graph keyed by qualified name (Module.Procedure).
 *
 * Every call site becomes its own call-graph edge; edges with the same endpoints are not
 * merged, so differing resolution status on the same pair survives. Unresolved targets
 * appear as call-graph nodes under their bare name.
 */
public class CfgAssembler {

    /**
     * Assemble the document for one module.
     *
     * @param moduleName declared module name
     * @param procedures built procedures, in source order
     * @return document ready to serialize or render
     */
    public CfgDocument assemble(String moduleName, List<CfgProcedure> procedures) {
        CfgDocument doc = new CfgDocument();
        doc.moduleName = moduleName;
        doc.procedures = new ArrayList<>(procedures);
        doc.callGraph = buildCallGraph(moduleName, procedures);

        long unresolved = doc.callGraph.edges.stream().filter(e -> !e.resolved).count();
        System.err.println("[vba-flow] Assembled " + moduleName + ": "
                + procedures.size() + " procedures, "
                + doc.callGraph.edges.size() + " call edges ("
                + unresolved + " unresolved)");
        return doc;
    }

    /**
     * Merge the call graphs of several module documents into one project call graph.
     */
    public CallGraph mergeCallGraphs(List<CfgDocument> documents) {
        Set<String> nodes = new LinkedHashSet<>();
        List<CallGraphEdge> edges = new ArrayList<>();
        for (CfgDocument doc : documents) {
            if (doc.callGraph == null) continue;
            nodes.addAll(doc.callGraph.nodes);
            edges.addAll(doc.callGraph.edges);
        }
        CallGraph merged = new CallGraph();
        merged.nodes = new ArrayList<>(nodes);
        merged.edges = edges;
        return merged;
    }

    CallGraph buildCallGraph(String moduleName, List<CfgProcedure> procedures) {
        Set<String> nodes = new LinkedHashSet<>();
        List<CallGraphEdge> edges = new ArrayList<>();

        for (CfgProcedure proc : procedures) {
            String caller = qualifiedName(moduleName, proc.name);
            nodes.add(caller);
            for (CallSite call : proc.calls) {
                nodes.add(call.target);
                CallGraphEdge edge = new CallGraphEdge();
                edge.from = caller;
                edge.to = call.target;
                edge.resolved = call.resolved;
                edge.sourceLine = call.sourceLine;
                edges.add(edge);
            }
        }

        CallGraph graph = new CallGraph();
        graph.nodes = new ArrayList<>(nodes);
        graph.edges = edges;
        return graph;
    }

    public static String qualifiedName(String moduleName, String procedureName) {
        return moduleName + "." + procedureName;
    }
}
