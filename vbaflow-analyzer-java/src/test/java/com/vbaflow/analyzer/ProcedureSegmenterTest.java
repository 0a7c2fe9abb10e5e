package com.vbaflow.analyzer;

import com.vbaflow.analyzer.static_analysis.ModuleSource;
import com.vbaflow.analyzer.static_analysis.ProcedureSegmenter;
import com.vbaflow.analyzer.static_analysis.ProcedureSegmenter.ProcedureSlice;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcedureSegmenterTest {

    private final ProcedureSegmenter segmenter = new ProcedureSegmenter();

    private List<ProcedureSlice> segment(String... lines) {
        ModuleSource module = ModuleSource.fromText(Paths.get("Sample.bas"), String.join("\n", lines));
        return segmenter.segment(module.lines());
    }

    @Test
    void findsEveryProcedureWithItsLineRange() {
        List<ProcedureSlice> slices = segment(
            "Attribute VB_Name = \"Sample\"",
            "Option Explicit",
            "",
            "Public Sub First()",
            "    x = 1",
            "End Sub",
            "",
            "Private Function Second(a As Long) As Long",
            "    Second = a",
            "End Function",
            "Property Get Total() As Long",
            "    Total = 0",
            "End Property");

        assertEquals(3, slices.size());

        assertEquals("First", slices.get(0).name());
        assertEquals("Sub", slices.get(0).kind());
        assertEquals(4, slices.get(0).startLine());
        assertEquals(6, slices.get(0).endLine());

        assertEquals("Second", slices.get(1).name());
        assertEquals("Function", slices.get(1).kind());
        assertEquals(8, slices.get(1).startLine());
        assertEquals(10, slices.get(1).endLine());

        assertEquals("Total", slices.get(2).name());
        assertEquals("Property Get", slices.get(2).kind());
    }

    @Test
    void bodyExcludesHeaderAndFooter() {
        ProcedureSlice slice = segment("Sub Go()", "    a = 1", "    b = 2", "End Sub").get(0);
        assertEquals(2, slice.body().size());
        assertEquals("a = 1", slice.body().get(0).code());
        assertEquals("b = 2", slice.body().get(1).code());
    }

    @Test
    void continuedHeaderIsRecognized() {
        ProcedureSlice slice = segment(
            "Public Function Join3(ByVal a As String, _",
            "                      ByVal b As String) As String",
            "    Join3 = a & b",
            "End Function").get(0);
        assertEquals("Join3", slice.name());
        assertEquals(1, slice.startLine());
        assertEquals(4, slice.endLine());
    }

    @Test
    void headerInsideBodyIsKeptAsBodyText() {
        List<ProcedureSlice> slices = segment("Sub Outer()", "Sub Inner()", "End Sub");
        assertEquals(1, slices.size());
        assertEquals("Outer", slices.get(0).name());
        assertEquals("Sub Inner()", slices.get(0).body().get(0).code());
    }

    @Test
    void unterminatedProcedureIsClosedAtLastLine() {
        List<ProcedureSlice> slices = segment("Sub Broken()", "    x = 1", "    y = 2");
        assertEquals(1, slices.size());
        assertEquals(3, slices.get(0).endLine());
    }

    @Test
    void moduleNameComesFromAttributeElseFileName() {
        assertEquals("Sample", ModuleSource.fromText(Paths.get("Other.bas"),
            "Attribute VB_Name = \"Sample\"\n").moduleName());
        assertEquals("Other", ModuleSource.fromText(Paths.get("dir/Other.bas"), "Sub A()\nEnd Sub\n").moduleName());
    }

    @Test
    void memberAttributesAreNotBodyLines() {
        List<ProcedureSlice> slices = segment(
            "Public Property Get Value() As Long",
            "Attribute Value.VB_UserMemId = 0",
            "    Value = 1",
            "End Property");

        assertEquals(1, slices.size());
        assertEquals(1, slices.get(0).body().size());
        assertEquals(3, slices.get(0).body().get(0).lineNumber());
    }
}
