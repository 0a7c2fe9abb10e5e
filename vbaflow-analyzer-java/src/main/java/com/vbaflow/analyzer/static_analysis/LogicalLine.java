package com.vbaflow.analyzer.static_analysis;

/**
 * One statement line after comment stripping and continuation joining.
 */
public record LogicalLine(
    int lineNumber,   // 1-based source line of the head line
    String code,      // trimmed statement text, empty for blank/comment-only/merged lines
    String comment    // inline comment text without the marker, nullable
) {
    public boolean isBlank() {
        return code.isEmpty();
    }
}
