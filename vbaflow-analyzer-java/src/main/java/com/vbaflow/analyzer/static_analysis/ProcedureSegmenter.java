package com.vbaflow.analyzer.static_analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Slices a module's normalized lines into procedure bodies by header/footer pairs.
 */
public class ProcedureSegmenter {

    /** Exported member attributes, e.g. {@code Attribute Value.VB_UserMemId = 0}. */
    private static final Pattern PROCEDURE_ATTRIBUTE = Pattern.compile("^Attribute\\s", Pattern.CASE_INSENSITIVE);

    /**
     * One procedure of a module. Line numbers are 1-based and include the header and footer.
     * {@code body} holds the lines strictly between them.
     */
    public record ProcedureSlice(
        String name,
        String kind,
        int startLine,
        int endLine,
        List<LogicalLine> body
    ) {}

    public List<ProcedureSlice> segment(List<LogicalLine> lines) {
        List<ProcedureSlice> result = new ArrayList<>();

        ProcedureHeader open = null;
        int openLine = 0;
        List<LogicalLine> body = null;

        for (LogicalLine line : lines) {
            if (line.isBlank()) {
                if (body != null) body.add(line);
                continue;
            }
            if (open == null) {
                Optional<ProcedureHeader> header = ProcedureHeader.match(line.code());
                if (header.isPresent()) {
                    open = header.get();
                    openLine = line.lineNumber();
                    body = new ArrayList<>();
                }
                continue;
            }
            if (ProcedureHeader.isFooter(line.code())) {
                result.add(new ProcedureSlice(open.name(), open.kind(), openLine, line.lineNumber(), body));
                open = null;
                body = null;
                continue;
            }
            if (PROCEDURE_ATTRIBUTE.matcher(line.code()).find()) continue;
            // Nested headers cannot occur in valid VBA; treat as ordinary body text
            body.add(line);
        }

        if (open != null) {
            int lastLine = lines.isEmpty() ? openLine : lines.get(lines.size() - 1).lineNumber();
            System.err.println("[vba-flow] WARNING: procedure " + open.name()
                + " has no End " + open.kind().split(" ")[0] + "; closing at line " + lastLine);
            result.add(new ProcedureSlice(open.name(), open.kind(), openLine, lastLine, body));
        }
        return result;
    }
}
