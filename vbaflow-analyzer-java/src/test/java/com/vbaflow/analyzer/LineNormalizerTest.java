package com.vbaflow.analyzer;

import com.vbaflow.analyzer.static_analysis.LineNormalizer;
import com.vbaflow.analyzer.static_analysis.LogicalLine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineNormalizerTest {

    private final LineNormalizer normalizer = new LineNormalizer();

    @Test
    void splitsOnAllLineTerminators() {
        assertEquals(List.of("a", "b", "c", "d"), LineNormalizer.splitLines("a\r\nb\rc\nd"));
    }

    @Test
    void outputIsIndexAlignedWithInput() {
        List<String> raw = List.of("x = 1", "", "y = 2");
        List<LogicalLine> lines = normalizer.normalize(raw);
        assertEquals(3, lines.size());
        for (int i = 0; i < lines.size(); i++) {
            assertEquals(i + 1, lines.get(i).lineNumber());
        }
    }

    @Test
    void continuationLinesAreJoinedOntoTheFirstLine() {
        List<LogicalLine> lines = normalizer.normalize(List.of(
            "total = a + _",
            "        b + _",
            "        c",
            "done = True"));

        assertEquals("total = a + b + c", lines.get(0).code());
        assertTrue(lines.get(1).isBlank(), "merged line should be left blank");
        assertTrue(lines.get(2).isBlank(), "merged line should be left blank");
        assertEquals("done = True", lines.get(3).code());
        assertEquals(4, lines.get(3).lineNumber());
    }

    @Test
    void trailingContinuationOnLastLinePassesThrough() {
        List<LogicalLine> lines = normalizer.normalize(List.of("x = 1 _"));
        assertEquals(1, lines.size());
        assertEquals("x = 1 _", lines.get(0).code());
    }

    @Test
    void commentIsStrippedAndKept() {
        LogicalLine line = normalizer.normalize(List.of("total = 0 ' reset")).get(0);
        assertEquals("total = 0", line.code());
        assertEquals("reset", line.comment());
    }

    @Test
    void apostropheInsideStringIsNotAComment() {
        LogicalLine line = normalizer.normalize(List.of("MsgBox \"it's done\" ' tell user")).get(0);
        assertEquals("MsgBox \"it's done\"", line.code());
        assertEquals("tell user", line.comment());
    }

    @Test
    void remStatementIsAComment() {
        LogicalLine line = normalizer.normalize(List.of("    Rem old code")).get(0);
        assertTrue(line.isBlank());
        assertEquals("old code", line.comment());
    }

    @Test
    void remarkableIdentifierIsNotRem() {
        LogicalLine line = normalizer.normalize(List.of("Remarks = 1")).get(0);
        assertEquals("Remarks = 1", line.code());
        assertNull(line.comment());
    }
}
