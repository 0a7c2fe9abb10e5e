package com.vbaflow.analyzer;

import com.vbaflow.analyzer.ir.CfgModel.CallGraphEdge;
import com.vbaflow.analyzer.ir.CfgModel.CallSite;
import com.vbaflow.analyzer.ir.CfgModel.CfgDocument;
import com.vbaflow.analyzer.ir.CfgModel.CfgEdge;
import com.vbaflow.analyzer.ir.CfgModel.CfgNode;
import com.vbaflow.analyzer.ir.CfgModel.CfgProcedure;
import com.vbaflow.analyzer.ir.CfgModel.NodeType;
import com.vbaflow.analyzer.manifest.ManifestConfig;
import com.vbaflow.analyzer.manifest.ManifestReader;
import com.vbaflow.analyzer.static_analysis.ModuleFileNotFoundException;
import com.vbaflow.analyzer.static_analysis.StaticAnalyzer;
import com.vbaflow.analyzer.static_analysis.SymbolTableBuilder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test: runs full analysis on the sample-workbook fixture.
 */
class StaticAnalyzerTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/sample-workbook");

    private static ManifestConfig config;
    private static CfgDocument doc;

    @BeforeAll
    static void runAnalysis() {
        config = new ManifestReader().read(FIXTURE_ROOT.resolve("manifest.json"));
        doc = new StaticAnalyzer(config).analyzeModule(FIXTURE_ROOT.resolve("Module1.bas"), FIXTURE_ROOT);
    }

    private static CfgProcedure procedure(String name) {
        return doc.procedures.stream().filter(p -> p.name.equals(name)).findFirst()
            .orElseThrow(() -> new AssertionError("procedure not found: " + name));
    }

    @Test
    void proceduresAreListedInSourceOrder() {
        assertEquals("Module1", doc.moduleName);
        List<String> names = doc.procedures.stream().map(p -> p.name).collect(Collectors.toList());
        assertEquals(List.of("Main", "Compute", "Cleanup"), names);

        CfgProcedure main = procedure("Main");
        assertEquals("Sub", main.kind);
        assertEquals(5, main.startLine);
        assertEquals(22, main.endLine);
        assertEquals("Function", procedure("Compute").kind);
    }

    @Test
    void everyProcedureHasOneEntryWithNoPredecessors() {
        for (CfgProcedure proc : doc.procedures) {
            long in = proc.edges.stream().filter(e -> e.to.equals("start")).count();
            long out = proc.edges.stream().filter(e -> e.from.equals("start")).count();
            assertEquals(0, in, proc.name + ": start has predecessors");
            assertTrue(out >= 1, proc.name + ": start has no successor");
        }
    }

    @Test
    void edgesOnlyReferenceKnownNodes() {
        for (CfgProcedure proc : doc.procedures) {
            List<String> ids = proc.nodes.stream().map(n -> n.id).collect(Collectors.toList());
            assertEquals(ids.size(), ids.stream().distinct().count(), proc.name + ": duplicate node ids");
            for (CfgEdge e : proc.edges) {
                assertTrue(ids.contains(e.from), proc.name + ": unknown source " + e.from);
                assertTrue(ids.contains(e.to), proc.name + ": unknown target " + e.to);
            }
        }
    }

    @Test
    void mainResolvesCallsAcrossModules() {
        List<String> targets = procedure("Main").calls.stream().map(c -> c.target).collect(Collectors.toList());
        assertEquals(List.of("Helpers.LogMessage", "Helpers.Square", "Module1.Compute", "Foo"), targets);
    }

    @Test
    void unresolvedCallDoesNotAbortTheRun() {
        Optional<CallSite> foo = procedure("Main").calls.stream()
            .filter(c -> c.target.equals("Foo")).findFirst();
        assertTrue(foo.isPresent());
        assertFalse(foo.get().resolved);
        assertEquals(21, foo.get().sourceLine);

        Optional<CallGraphEdge> edge = doc.callGraph.edges.stream()
            .filter(e -> e.to.equals("Foo")).findFirst();
        assertTrue(edge.isPresent());
        assertEquals("Module1.Main", edge.get().from);
        assertFalse(edge.get().resolved);
    }

    @Test
    void mainLoopIsRecorded() {
        CfgProcedure main = procedure("Main");
        assertEquals(1, main.loopSpans.size());
        assertEquals("L16", main.loopSpans.get(0).headId);
        assertEquals("L19", main.loopSpans.get(0).endId);
    }

    @Test
    void inlineCommentIsKeptOnNode() {
        CfgNode node = procedure("Main").nodes.stream()
            .filter(n -> n.id.equals("L20")).findFirst().orElseThrow();
        assertEquals(NodeType.CALL, node.type);
        assertEquals("combine", node.comment);
    }

    @Test
    void selectCaseInContinuedFunction() {
        CfgProcedure compute = procedure("Compute");
        assertEquals(24, compute.startLine);
        long cases = compute.nodes.stream().filter(n -> n.type == NodeType.CASE).count();
        assertEquals(3, cases);
        long intoJoin = compute.edges.stream().filter(e -> e.to.equals("L32")).count();
        assertEquals(3, intoJoin, "every case arm reaches End Select");
    }

    @Test
    void exitForAndErrorLabelInCleanup() {
        CfgProcedure cleanup = procedure("Cleanup");
        assertTrue(cleanup.edges.stream().anyMatch(e ->
            e.from.equals("L39_1") && e.to.equals("L41") && e.label.equals("exit")));
        assertTrue(cleanup.nodes.stream().anyMatch(n -> n.id.equals("L43") && n.type == NodeType.LABEL));
        assertTrue(cleanup.calls.stream().anyMatch(c -> c.target.equals("Helpers.LogMessage") && c.resolved));
    }

    @Test
    void analyzeProjectCoversEveryModule() {
        List<CfgDocument> docs = new StaticAnalyzer(config).analyzeProject(FIXTURE_ROOT);
        List<String> modules = docs.stream().map(d -> d.moduleName).collect(Collectors.toList());
        assertEquals(List.of("Counter", "Helpers", "Module1"), modules);

        CfgDocument counter = docs.get(0);
        assertEquals("Property Get", counter.procedures.get(0).kind);
        assertEquals("Property Let", counter.procedures.get(1).kind);
        assertEquals("Count", counter.procedures.get(1).name);
        assertTrue(counter.procedures.get(1).nodes.stream()
            .noneMatch(n -> n.text != null && n.text.startsWith("Attribute")));
        assertTrue(counter.callGraph.edges.stream().anyMatch(e ->
            e.from.equals("Counter.Increment") && e.to.equals("Helpers.LogMessage") && e.resolved));
    }

    @Test
    void missingSourceDirFails(@TempDir Path tmp) {
        assertThrows(SymbolTableBuilder.DirectoryNotFoundException.class, () ->
            new StaticAnalyzer(config).analyzeModule(FIXTURE_ROOT.resolve("Module1.bas"), tmp.resolve("gone")));
    }

    @Test
    void missingTargetFails() {
        assertThrows(ModuleFileNotFoundException.class, () ->
            new StaticAnalyzer(config).analyzeModule(FIXTURE_ROOT.resolve("Missing.bas"), FIXTURE_ROOT));
    }
}
