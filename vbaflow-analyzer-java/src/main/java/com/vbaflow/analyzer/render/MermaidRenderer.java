package com.vbaflow.analyzer.render;

import com.vbaflow.analyzer.ir.CfgModel.CallGraph;
import com.vbaflow.analyzer.ir.CfgModel.CallGraphEdge;
import com.vbaflow.analyzer.ir.CfgModel.CfgDocument;
import com.vbaflow.analyzer.ir.CfgModel.CfgNode;
import com.vbaflow.analyzer.ir.CfgModel.CfgProcedure;
import com.vbaflow.analyzer.ir.CfgModel.NodeType;
import com.vbaflow.analyzer.ir.CfgReader;
import com.vbaflow.analyzer.ir.InvalidDocumentException;
import com.vbaflow.analyzer.render.FlowRewriter.DrawnEdge;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Renders procedure control-flow graphs and call graphs as Mermaid flowchart markup.
 *
 * Procedure node ids are drawn as {@code n_<id>} and call-graph nodes as {@code p_<name>},
 * both escaped by {@link MermaidText#id}. Each node is drawn once and each distinct edge
 * line at most once. Loop back edges are dashed and labeled {@code loop}.
 */
public class MermaidRenderer {

    static final String NODE_PREFIX = "n_";
    static final String PROC_PREFIX = "p_";
    static final String UNRESOLVED = "unresolved";

    private static final String INDENT = "    ";

    private final String flowDirection;
    private final String callGraphDirection;

    public MermaidRenderer() {
        this("TD", "LR");
    }

    public MermaidRenderer(String flowDirection, String callGraphDirection) {
        this.flowDirection = flowDirection;
        this.callGraphDirection = callGraphDirection;
    }

    /**
     * Render every procedure of a document.
     *
     * Diagrams are keyed by procedure name. Names shared by several procedures, as with a
     * {@code Property Get}/{@code Property Let} pair, are qualified by kind: {@code Value.PropertyLet}.
     *
     * @return diagram key to markup, in document order
     * @throws InvalidDocumentException if the document is missing or malformed
     */
    public Map<String, String> renderDocument(CfgDocument doc) {
        CfgReader.validate(doc);
        Map<String, Integer> nameCounts = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (CfgProcedure proc : doc.procedures) {
            nameCounts.merge(proc.name, 1, Integer::sum);
        }
        Map<String, String> diagrams = new LinkedHashMap<>();
        for (CfgProcedure proc : doc.procedures) {
            String key = nameCounts.get(proc.name) > 1 ? diagramKey(proc) : proc.name;
            if (diagrams.containsKey(key)) {
                key = key + "." + proc.startLine;
            }
            diagrams.put(key, renderProcedure(proc));
        }
        System.err.println("[vba-flow] Rendered " + diagrams.size() + " diagrams for " + doc.moduleName);
        return diagrams;
    }

    public String renderProcedure(CfgProcedure proc) {
        StringBuilder sb = new StringBuilder();
        sb.append("flowchart ").append(flowDirection).append('\n');

        Set<String> drawnNodes = new HashSet<>();
        boolean spacers = false;
        for (CfgNode node : proc.nodes) {
            if (!drawnNodes.add(node.id)) continue;
            sb.append(INDENT).append(nodeLine(node)).append('\n');
            spacers |= node.type == NodeType.SPACER;
        }

        Set<String> edgeLines = new LinkedHashSet<>();
        for (DrawnEdge edge : new FlowRewriter(proc).rewrite()) {
            edgeLines.add(edgeLine(
                MermaidText.id(NODE_PREFIX, edge.from()),
                MermaidText.id(NODE_PREFIX, edge.to()),
                edge.label(), edge.dashed()));
        }
        for (String line : edgeLines) {
            sb.append(INDENT).append(line).append('\n');
        }

        if (spacers) {
            sb.append(INDENT).append("classDef spacer fill:none,stroke:none\n");
        }
        return sb.toString();
    }

    /**
     * Render a call graph. Unresolved edges are dashed and annotated; targets reached only
     * through unresolved calls are styled as unresolved nodes.
     */
    public String renderCallGraph(CallGraph graph) {
        if (graph == null) {
            throw new InvalidDocumentException("Call graph is missing");
        }
        StringBuilder sb = new StringBuilder();
        sb.append("flowchart ").append(callGraphDirection).append('\n');

        Set<String> nodes = new LinkedHashSet<>();
        if (graph.nodes != null) {
            for (String name : graph.nodes) {
                if (name != null) nodes.add(name);
            }
        }
        // Targets reached only through unresolved calls, and never calling anything
        Set<String> unresolvedOnly = new LinkedHashSet<>();
        Set<String> plain = new HashSet<>();
        if (graph.edges != null) {
            for (CallGraphEdge edge : graph.edges) {
                if (edge == null || edge.from == null || edge.to == null) continue;
                nodes.add(edge.from);
                nodes.add(edge.to);
                plain.add(edge.from);
                if (edge.resolved) {
                    plain.add(edge.to);
                } else {
                    unresolvedOnly.add(edge.to);
                }
            }
        }
        unresolvedOnly.removeAll(plain);

        for (String name : nodes) {
            sb.append(INDENT).append(MermaidText.id(PROC_PREFIX, name))
              .append("[\"").append(MermaidText.label(name)).append("\"]");
            if (unresolvedOnly.contains(name)) sb.append(":::").append(UNRESOLVED);
            sb.append('\n');
        }

        Set<String> edgeLines = new LinkedHashSet<>();
        if (graph.edges != null) {
            for (CallGraphEdge edge : graph.edges) {
                if (edge == null || edge.from == null || edge.to == null) {
                    System.err.println("[vba-flow] WARNING: render call graph: incomplete edge skipped");
                    continue;
                }
                edgeLines.add(edgeLine(
                    MermaidText.id(PROC_PREFIX, edge.from),
                    MermaidText.id(PROC_PREFIX, edge.to),
                    edge.resolved ? "" : UNRESOLVED,
                    !edge.resolved));
            }
        }
        for (String line : edgeLines) {
            sb.append(INDENT).append(line).append('\n');
        }
        if (!unresolvedOnly.isEmpty()) {
            sb.append(INDENT).append("classDef ").append(UNRESOLVED)
              .append(" stroke-dasharray: 5 5,color:#888\n");
        }
        return sb.toString();
    }

    /** {@code Value} + {@code Property Let} -> {@code Value.PropertyLet} */
    static String diagramKey(CfgProcedure proc) {
        String kind = proc.kind == null ? "" : proc.kind.replaceAll("\\s+", "");
        return kind.isEmpty() ? proc.name : proc.name + "." + kind;
    }

    private static String nodeLine(CfgNode node) {
        String id = MermaidText.id(NODE_PREFIX, node.id);
        String text = MermaidText.label(node.text);
        if (node.comment != null && !node.comment.isBlank()) {
            text = text + "<br/>' " + MermaidText.label(node.comment.trim());
        }
        NodeType type = node.type;
        if (type == NodeType.JOIN && FlowRewriter.isLoopTerminator(node)) {
            type = NodeType.LOOP_END;
        }
        return switch (type) {
            case START, END -> id + "([\"" + text + "\"])";
            case COND, SWITCH -> id + "{\"" + text + "\"}";
            case LOOP -> id + "{{\"" + text + "\"}}";
            case LOOP_END -> id + "[/\"" + text + "\"\\]";
            case JOIN -> id + "((\" \"))";
            case CASE -> id + "[/\"" + text + "\"/]";
            case CALL -> id + "[[\"" + text + "\"]]";
            case LABEL -> id + ">\"" + text + "\"]";
            case GOTO -> id + "[\\\"" + text + "\"\\]";
            case BLOCK -> id + "(\"" + text + "\")";
            case SPACER -> id + "[\" \"]:::spacer";
            case OP -> id + "[\"" + text + "\"]";
        };
    }

    private static String edgeLine(String from, String to, String label, boolean dashed) {
        String arrow = dashed ? " -.->" : " -->";
        if (label == null || label.isEmpty()) {
            return from + arrow + " " + to;
        }
        return from + arrow + "|" + MermaidText.label(label) + "| " + to;
    }
}
