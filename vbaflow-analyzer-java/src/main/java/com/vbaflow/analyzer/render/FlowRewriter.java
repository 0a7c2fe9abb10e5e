package com.vbaflow.analyzer.render;

import com.vbaflow.analyzer.ir.CfgModel.CfgEdge;
import com.vbaflow.analyzer.ir.CfgModel.CfgNode;
import com.vbaflow.analyzer.ir.CfgModel.CfgProcedure;
import com.vbaflow.analyzer.ir.CfgModel.LoopSpan;
import com.vbaflow.analyzer.ir.CfgModel.NodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Recovers the drawing structure of a procedure from its flat edge list: loop terminators,
 * loop spans, Yes/No labels of unlabeled condition edges, and back edges into loop headers.
 * The input procedure is not modified.
 */
class FlowRewriter {

    /** One edge as it will be drawn. */
    record DrawnEdge(String from, String to, String label, boolean dashed) {}

    static final String LOOP_LABEL = "loop";

    private static final Pattern LOOP_TERMINATOR_TEXT = Pattern.compile(
        "^(?:Loop|Next|Wend|For\\s+Next\\s+End|Loop\\s+End|While\\s+End|Do\\s+End)\\b.*",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern NEGATED_COND = Pattern.compile(
        "^(?:Else)?If\\s+Not\\b.*", Pattern.CASE_INSENSITIVE);

    private static final Pattern WHILE_HEAD = Pattern.compile("^(?:Do\\s+)?While\\b.*", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNTIL_HEAD = Pattern.compile("^Do\\s+Until\\b.*", Pattern.CASE_INSENSITIVE);

    private final CfgProcedure procedure;
    private final Map<String, CfgNode> nodes = new LinkedHashMap<>();

    FlowRewriter(CfgProcedure procedure) {
        this.procedure = procedure;
        for (CfgNode node : procedure.nodes) {
            nodes.putIfAbsent(node.id, node);
        }
    }

    /**
     * True for nodes that close a loop: {@code loopEnd} nodes, and joins whose text names
     * a loop terminator ("Loop End", "For Next End", ...).
     */
    static boolean isLoopTerminator(CfgNode node) {
        if (node.type == NodeType.LOOP_END) return true;
        return node.type == NodeType.JOIN && node.text != null
            && LOOP_TERMINATOR_TEXT.matcher(node.text.trim()).matches();
    }

    /**
     * Loop spans usable for drawing. Recorded spans are taken when present, else spans are
     * derived by pairing loop headers with terminators in line order. Spans naming unknown
     * nodes are skipped.
     */
    List<LoopSpan> loopSpans() {
        List<LoopSpan> recorded = procedure.loopSpans != null ? procedure.loopSpans : List.of();
        if (recorded.isEmpty()) return deriveLoopSpans();

        List<LoopSpan> valid = new ArrayList<>();
        for (LoopSpan span : recorded) {
            if (span == null || !nodes.containsKey(span.headId) || !nodes.containsKey(span.endId)) {
                warn("loop span " + (span == null ? "null" : span.headId + ".." + span.endId)
                    + " references unknown nodes; skipped");
                continue;
            }
            valid.add(span);
        }
        return valid;
    }

    private List<LoopSpan> deriveLoopSpans() {
        List<CfgNode> ordered = new ArrayList<>(nodes.values());
        ordered.sort(Comparator.comparingInt(n -> n.sourceLine));

        List<LoopSpan> spans = new ArrayList<>();
        Deque<CfgNode> open = new ArrayDeque<>();
        for (CfgNode node : ordered) {
            if (node.type == NodeType.LOOP) {
                open.push(node);
            } else if (isLoopTerminator(node) && !open.isEmpty()) {
                CfgNode head = open.pop();
                spans.add(new LoopSpan(head.id, node.id, head.sourceLine, node.sourceLine));
            }
        }
        return spans;
    }

    /**
     * Edges to draw, in input order, followed by any synthesized loop back edges.
     */
    List<DrawnEdge> rewrite() {
        List<CfgEdge> edges = new ArrayList<>();
        for (CfgEdge edge : procedure.edges) {
            if (edge == null || !nodes.containsKey(edge.from) || !nodes.containsKey(edge.to)) {
                warn("edge " + (edge == null ? "null" : edge.from + " -> " + edge.to)
                    + " references unknown nodes; skipped");
                continue;
            }
            edges.add(new CfgEdge(edge.from, edge.to, edge.label == null ? "" : edge.label));
        }

        resolveConditionLabels(edges);

        List<LoopSpan> spans = loopSpans();
        List<DrawnEdge> drawn = new ArrayList<>();
        for (CfgEdge edge : edges) {
            LoopSpan span = reentrySpan(edge, spans);
            if (span != null) {
                // Body edge back into the header is drawn into the terminator instead
                drawn.add(new DrawnEdge(edge.from, span.endId, edge.label, false));
                continue;
            }
            LoopSpan back = backEdgeSpan(edge, spans);
            if (back != null) {
                drawn.add(new DrawnEdge(edge.from, edge.to, LOOP_LABEL, true));
                continue;
            }
            drawn.add(new DrawnEdge(edge.from, edge.to, continueLabel(edge, spans), false));
        }

        for (LoopSpan span : spans) {
            boolean present = drawn.stream().anyMatch(e -> e.dashed()
                && e.from().equals(span.endId) && e.to().equals(span.headId));
            if (!present) {
                drawn.add(new DrawnEdge(span.endId, span.headId, LOOP_LABEL, true));
            }
        }
        return drawn;
    }

    /**
     * Fill in Yes/No on unlabeled condition edges: non-join targets sorted by source line,
     * first is Yes and last is No, swapped for negated conditions. An unlabeled edge to a
     * join takes whichever of Yes/No the condition does not use yet.
     */
    private void resolveConditionLabels(List<CfgEdge> edges) {
        for (CfgNode cond : nodes.values()) {
            if (cond.type != NodeType.COND) continue;

            List<CfgEdge> outgoing = new ArrayList<>();
            for (CfgEdge e : edges) {
                if (e.from.equals(cond.id)) outgoing.add(e);
            }
            boolean negated = cond.text != null && NEGATED_COND.matcher(cond.text.trim()).matches();
            String first = negated ? "No" : "Yes";
            String last = negated ? "Yes" : "No";

            List<CfgEdge> branches = new ArrayList<>();
            for (CfgEdge e : outgoing) {
                if (e.label.isEmpty() && nodes.get(e.to).type != NodeType.JOIN) branches.add(e);
            }
            branches.sort(Comparator.comparingInt(e -> nodes.get(e.to).sourceLine));
            if (!branches.isEmpty()) {
                branches.get(0).label = first;
                if (branches.size() > 1) branches.get(branches.size() - 1).label = last;
            }

            for (CfgEdge e : outgoing) {
                if (!e.label.isEmpty() || nodes.get(e.to).type != NodeType.JOIN) continue;
                boolean hasYes = outgoing.stream().anyMatch(o -> "Yes".equals(o.label));
                boolean hasNo = outgoing.stream().anyMatch(o -> "No".equals(o.label));
                if (!hasNo) {
                    e.label = "No";
                } else if (!hasYes) {
                    e.label = "Yes";
                }
            }
        }
    }

    private LoopSpan reentrySpan(CfgEdge edge, List<LoopSpan> spans) {
        for (LoopSpan span : spans) {
            if (!edge.to.equals(span.headId)) continue;
            if (edge.from.equals(span.endId) || edge.from.equals(span.headId)) continue;
            int line = nodes.get(edge.from).sourceLine;
            if (line >= span.startLine && line <= span.endLine) return span;
        }
        return null;
    }

    private static LoopSpan backEdgeSpan(CfgEdge edge, List<LoopSpan> spans) {
        for (LoopSpan span : spans) {
            if (edge.from.equals(span.endId) && edge.to.equals(span.headId)) return span;
        }
        return null;
    }

    /** Unlabeled edge from a While/Until header into its body gets the entry label. */
    private String continueLabel(CfgEdge edge, List<LoopSpan> spans) {
        if (!edge.label.isEmpty()) return edge.label;
        for (LoopSpan span : spans) {
            if (!edge.from.equals(span.headId) || edge.to.equals(span.endId)) continue;
            String text = nodes.get(span.headId).text;
            if (text == null) return "";
            if (WHILE_HEAD.matcher(text.trim()).matches()) return "Yes";
            if (UNTIL_HEAD.matcher(text.trim()).matches()) return "No";
        }
        return "";
    }

    private void warn(String message) {
        System.err.println("[vba-flow] WARNING: render " + procedure.name + ": " + message);
    }
}
