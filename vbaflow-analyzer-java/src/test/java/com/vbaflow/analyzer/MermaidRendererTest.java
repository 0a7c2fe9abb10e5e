package com.vbaflow.analyzer;

import com.vbaflow.analyzer.ir.CfgAssembler;
import com.vbaflow.analyzer.ir.CfgModel.CfgDocument;
import com.vbaflow.analyzer.ir.CfgModel.CfgEdge;
import com.vbaflow.analyzer.ir.CfgModel.CfgNode;
import com.vbaflow.analyzer.ir.CfgModel.CfgProcedure;
import com.vbaflow.analyzer.ir.CfgModel.LoopSpan;
import com.vbaflow.analyzer.ir.CfgModel.NodeType;
import com.vbaflow.analyzer.ir.InvalidDocumentException;
import com.vbaflow.analyzer.render.MermaidRenderer;
import com.vbaflow.analyzer.static_analysis.ControlFlowBuilder;
import com.vbaflow.analyzer.static_analysis.ModuleSource;
import com.vbaflow.analyzer.static_analysis.ProcedureSegmenter;
import com.vbaflow.analyzer.static_analysis.SymbolTable;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class MermaidRendererTest {

    private static final Pattern BACK_EDGE = Pattern.compile("n_(\\w+) -\\.->\\|loop\\| n_(\\w+)");

    private final MermaidRenderer renderer = new MermaidRenderer();

    private static CfgProcedure build(String... lines) {
        ModuleSource module = ModuleSource.fromText(Paths.get("Sample.bas"), String.join("\n", lines));
        return new ControlFlowBuilder().build(
            new ProcedureSegmenter().segment(module.lines()).get(0), "Sample", SymbolTable.empty());
    }

    private static CfgProcedure proc(String name) {
        CfgProcedure p = new CfgProcedure();
        p.name = name;
        p.kind = "Sub";
        return p;
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) count++;
        return count;
    }

    @Test
    void doWhileRendersDashedBackEdgeAndYesContinue() {
        CfgProcedure p = build(
            "Sub Count()",
            "    Do While i < 10",
            "        i = i + 1",
            "    Loop",
            "End Sub");
        String out = renderer.renderProcedure(p);

        assertTrue(out.startsWith("flowchart TD\n"));
        assertTrue(out.contains("n_L2{{\"Do While i #lt; 10\"}}"), out);
        assertTrue(out.contains("n_L2 -->|Yes| n_L3"), out);
        assertTrue(out.contains("n_L4 -.->|loop| n_L2"), out);
        assertTrue(out.contains("n_L4 -->|exit| n_end"), out);
    }

    @Test
    void renderedBackEdgeMatchesRecordedLoopSpan() {
        CfgProcedure p = build(
            "Sub Nested()",
            "    For i = 1 To 3",
            "        Do",
            "            j = j + 1",
            "        Loop Until j > i",
            "    Next i",
            "End Sub");
        String out = renderer.renderProcedure(p);

        assertEquals(2, p.loopSpans.size());
        Matcher m = BACK_EDGE.matcher(out);
        int found = 0;
        while (m.find()) {
            String endId = m.group(1);
            String headId = m.group(2);
            assertTrue(p.loopSpans.stream().anyMatch(s -> s.endId.equals(endId) && s.headId.equals(headId)),
                "back edge " + endId + " -> " + headId + " has no recorded span");
            found++;
        }
        assertEquals(2, found);
    }

    @Test
    void unlabeledConditionEdgesAreResolvedByLine() {
        CfgProcedure p = proc("Check");
        p.nodes.add(new CfgNode("L2", NodeType.COND, "If ok?", 2, null));
        p.nodes.add(new CfgNode("L3", NodeType.OP, "a = 1", 3, null));
        p.nodes.add(new CfgNode("L5", NodeType.OP, "a = 2", 5, null));
        p.edges.add(new CfgEdge("L2", "L5", ""));
        p.edges.add(new CfgEdge("L2", "L3", ""));

        String out = renderer.renderProcedure(p);
        assertTrue(out.contains("n_L2 -->|Yes| n_L3"), out);
        assertTrue(out.contains("n_L2 -->|No| n_L5"), out);
    }

    @Test
    void negatedConditionSwapsResolvedLabels() {
        CfgProcedure p = proc("Check");
        p.nodes.add(new CfgNode("L2", NodeType.COND, "If Not ok?", 2, null));
        p.nodes.add(new CfgNode("L3", NodeType.OP, "a = 1", 3, null));
        p.nodes.add(new CfgNode("L5", NodeType.OP, "a = 2", 5, null));
        p.edges.add(new CfgEdge("L2", "L3", ""));
        p.edges.add(new CfgEdge("L2", "L5", ""));

        String out = renderer.renderProcedure(p);
        assertTrue(out.contains("n_L2 -->|No| n_L3"), out);
        assertTrue(out.contains("n_L2 -->|Yes| n_L5"), out);
    }

    @Test
    void unlabeledEdgeToJoinTakesTheRemainingLabel() {
        CfgProcedure p = proc("Check");
        p.nodes.add(new CfgNode("L2", NodeType.COND, "If ok?", 2, null));
        p.nodes.add(new CfgNode("L3", NodeType.OP, "a = 1", 3, null));
        p.nodes.add(new CfgNode("L4", NodeType.JOIN, "End If", 4, null));
        p.edges.add(new CfgEdge("L2", "L3", ""));
        p.edges.add(new CfgEdge("L2", "L4", ""));
        p.edges.add(new CfgEdge("L3", "L4", ""));

        String out = renderer.renderProcedure(p);
        assertTrue(out.contains("n_L2 -->|Yes| n_L3"), out);
        assertTrue(out.contains("n_L2 -->|No| n_L4"), out);
        assertTrue(out.contains("n_L4((\" \"))"), "If join renders as an empty circle");
    }

    @Test
    void explicitLabelsAreKept() {
        CfgProcedure p = build(
            "Sub Guard()",
            "    If Not ready Then",
            "        x = 1",
            "    End If",
            "End Sub");
        String out = renderer.renderProcedure(p);
        assertTrue(out.contains("n_L2 -->|Yes| n_L3"), out);
        assertTrue(out.contains("n_L2 -->|No| n_L4"), out);
    }

    @Test
    void bodyEdgeBackIntoHeaderIsRedirectedToTerminator() {
        CfgProcedure p = proc("Spin");
        p.nodes.add(new CfgNode("L2", NodeType.LOOP, "Do", 2, null));
        p.nodes.add(new CfgNode("L3", NodeType.OP, "x = x + 1", 3, null));
        p.nodes.add(new CfgNode("L4", NodeType.LOOP_END, "Loop", 4, null));
        p.edges.add(new CfgEdge("L2", "L3", ""));
        p.edges.add(new CfgEdge("L3", "L2", ""));
        p.edges.add(new CfgEdge("L4", "L2", "loop"));
        p.loopSpans.add(new LoopSpan("L2", "L4", 2, 4));

        String out = renderer.renderProcedure(p);
        assertFalse(out.contains("n_L3 --> n_L2"), out);
        assertTrue(out.contains("n_L3 --> n_L4"), out);
        assertTrue(out.contains("n_L4 -.->|loop| n_L2"), out);
    }

    @Test
    void loopSpansAreDerivedWhenNotRecorded() {
        CfgProcedure p = proc("Legacy");
        p.nodes.add(new CfgNode("L2", NodeType.LOOP, "While n < 3", 2, null));
        p.nodes.add(new CfgNode("L3", NodeType.OP, "n = n + 1", 3, null));
        p.nodes.add(new CfgNode("L4", NodeType.JOIN, "Loop End", 4, null));
        p.edges.add(new CfgEdge("L2", "L3", ""));
        p.edges.add(new CfgEdge("L3", "L4", ""));

        String out = renderer.renderProcedure(p);
        assertTrue(out.contains("n_L4[/\"Loop End\"\\]"), "loop-terminator join drawn as loop end: " + out);
        assertTrue(out.contains("n_L4 -.->|loop| n_L2"), out);
        assertTrue(out.contains("n_L2 -->|Yes| n_L3"), out);
    }

    @Test
    void spanWithUnknownNodesIsSkipped() {
        CfgProcedure p = proc("Broken");
        p.nodes.add(new CfgNode("start", NodeType.START, "Sub Broken", 1, null));
        p.nodes.add(new CfgNode("end", NodeType.END, "End Sub", 2, null));
        p.edges.add(new CfgEdge("start", "end", ""));
        p.edges.add(new CfgEdge("start", "L9", ""));
        p.loopSpans.add(new LoopSpan("L7", "L8", 7, 8));

        String out = assertDoesNotThrow(() -> renderer.renderProcedure(p));
        assertTrue(out.contains("n_start --> n_end"));
        assertFalse(out.contains("L9"));
        assertFalse(out.contains("L7"));
    }

    @Test
    void duplicateEdgesAreEmittedOnce() {
        CfgProcedure p = proc("Dup");
        p.nodes.add(new CfgNode("start", NodeType.START, "Sub Dup", 1, null));
        p.nodes.add(new CfgNode("L2", NodeType.OP, "x = 1", 2, null));
        p.nodes.add(new CfgNode("L2", NodeType.OP, "x = 1", 2, null));
        p.edges.add(new CfgEdge("start", "L2", ""));
        p.edges.add(new CfgEdge("start", "L2", ""));
        p.edges.add(new CfgEdge("start", "L2", "goto"));

        String out = renderer.renderProcedure(p);
        assertEquals(1, occurrences(out, "n_start --> n_L2"));
        assertEquals(1, occurrences(out, "n_start -->|goto| n_L2"), "different label is a different edge");
        assertEquals(1, occurrences(out, "n_L2[\""));
    }

    @Test
    void identifiersAreSanitizedAndTextEscaped() {
        CfgProcedure p = proc("集計");
        p.nodes.add(new CfgNode("start", NodeType.START, "Sub 集計", 1, null));
        p.nodes.add(new CfgNode("L2.a", NodeType.OP, "s = \"[x]\" | t", 2, "合計 {note}"));
        p.edges.add(new CfgEdge("start", "L2.a", "Case \"A\""));

        String out = renderer.renderProcedure(p);
        assertTrue(out.contains("n_start([\"Sub 集計\"])"), out);
        assertTrue(out.contains("n_L2_x2E_a[\"s = #quot;#91;x#93;#quot; #124; t<br/>' 合計 #123;note#125;\"]"), out);
        assertTrue(out.contains("n_start -->|Case #quot;A#quot;| n_L2_x2E_a"), out);
    }

    @Test
    void nodeShapesFollowNodeType() {
        CfgProcedure p = build(
            "Sub Shapes()",
            "    Select Case n",
            "        Case 1",
            "            Call Work",
            "    End Select",
            "    GoTo Done",
            "Done:",
            "End Sub");
        String out = renderer.renderProcedure(p);
        assertTrue(out.contains("n_L2{\"Select Case n\"}"), out);
        assertTrue(out.contains("n_L3[/\"Case 1\"/]"), out);
        assertTrue(out.contains("n_L4[[\"Call Work\"]]"), out);
        assertTrue(out.contains("n_L6[\\\"GoTo Done\"\\]"), out);
        assertTrue(out.contains("n_L7>\"Done:\"]"), out);
        assertTrue(out.contains("n_L3 --> n_L4"), out);
        assertTrue(out.contains("n_L2 -->|1| n_L3"), out);
    }

    @Test
    void directionIsConfigurable() {
        CfgProcedure p = build("Sub A()", "End Sub");
        assertTrue(new MermaidRenderer("LR", "TD").renderProcedure(p).startsWith("flowchart LR\n"));
    }

    @Test
    void renderDocumentProducesOneDiagramPerProcedure() {
        CfgDocument doc = new CfgAssembler().assemble("Sample", List.of(
            build("Sub A()", "End Sub"),
            build("Function B()", "    B = 1", "End Function")));
        Map<String, String> diagrams = renderer.renderDocument(doc);
        assertEquals(List.of("A", "B"), List.copyOf(diagrams.keySet()));
        assertTrue(diagrams.get("B").contains("n_end([\"End Function\"])"));
    }

    @Test
    void propertyGetAndLetEachKeepTheirDiagram() {
        CfgDocument doc = new CfgAssembler().assemble("Sample", List.of(
            build("Property Get Value() As Long", "    Value = mValue", "End Property"),
            build("Property Let Value(v As Long)", "    mValue = v", "End Property"),
            build("Sub A()", "End Sub")));
        Map<String, String> diagrams = renderer.renderDocument(doc);

        assertEquals(List.of("Value.PropertyGet", "Value.PropertyLet", "A"), List.copyOf(diagrams.keySet()));
        assertTrue(diagrams.get("Value.PropertyGet").contains("Value = mValue"));
        assertTrue(diagrams.get("Value.PropertyLet").contains("mValue = v"));
    }

    @Test
    void missingDocumentIsInvalid() {
        assertThrows(InvalidDocumentException.class, () -> renderer.renderDocument(null));
    }

    @Test
    void documentWithoutProceduresIsInvalid() {
        CfgDocument doc = new CfgDocument();
        doc.moduleName = "Sample";
        assertThrows(InvalidDocumentException.class, () -> renderer.renderDocument(doc));
    }
}
