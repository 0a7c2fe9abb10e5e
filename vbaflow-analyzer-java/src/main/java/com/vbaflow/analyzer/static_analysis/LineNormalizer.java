package com.vbaflow.analyzer.static_analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns raw module text into logical statement lines.
 *
 * Comments are stripped (a quote inside an open string literal is not a comment marker)
 * and continuation sequences ending in " _" are joined onto their head line.
 * The output is index-aligned with the input: line i of the result carries source line i+1,
 * and lines merged into a head line become blank.
 */
public class LineNormalizer {

    private static final String CONTINUATION = " _";

    /**
     * Split module text on CRLF, CR or LF.
     */
    public static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) return new ArrayList<>();
        return new ArrayList<>(Arrays.asList(text.split("\r\n|\r|\n", -1)));
    }

    public List<LogicalLine> normalize(List<String> rawLines) {
        int n = rawLines.size();
        String[] code = new String[n];
        String[] comments = new String[n];
        for (int i = 0; i < n; i++) {
            String raw = rawLines.get(i) != null ? rawLines.get(i) : "";
            int cut = commentStart(raw);
            if (cut >= 0) {
                code[i] = raw.substring(0, cut).trim();
                comments[i] = commentText(raw.substring(cut));
            } else {
                code[i] = raw.trim();
                comments[i] = null;
            }
        }

        List<LogicalLine> result = new ArrayList<>(n);
        int i = 0;
        while (i < n) {
            if (!isContinued(code[i]) || i + 1 >= n) {
                // A trailing continuation with nothing after it passes through unchanged
                result.add(new LogicalLine(i + 1, code[i], comments[i]));
                i++;
                continue;
            }

            StringBuilder joined = new StringBuilder(dropMarker(code[i]));
            String comment = comments[i];
            int head = i;
            int j = i + 1;
            while (true) {
                String next = code[j];
                if (comment == null) comment = comments[j];
                if (isContinued(next) && j + 1 < n) {
                    appendPart(joined, dropMarker(next));
                    j++;
                } else {
                    appendPart(joined, next);
                    break;
                }
            }
            result.add(new LogicalLine(head + 1, joined.toString(), comment));
            for (int k = head + 1; k <= j; k++) {
                result.add(new LogicalLine(k + 1, "", null));
            }
            i = j + 1;
        }
        return result;
    }

    /**
     * Index of the comment marker that starts a comment on this line, or -1.
     * Quote characters toggle the string-literal state; a doubled quote toggles twice.
     */
    static int commentStart(String line) {
        String trimmed = line.stripLeading();
        int indent = line.length() - trimmed.length();
        if (isRemStatement(trimmed)) return indent;

        boolean inString = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (c == '\'' && !inString) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isRemStatement(String trimmed) {
        if (trimmed.length() < 3 || !trimmed.regionMatches(true, 0, "Rem", 0, 3)) return false;
        return trimmed.length() == 3 || Character.isWhitespace(trimmed.charAt(3));
    }

    private static String commentText(String fromMarker) {
        String text = fromMarker.startsWith("'") ? fromMarker.substring(1) : fromMarker.substring(3);
        text = text.trim();
        return text.isEmpty() ? null : text;
    }

    private static boolean isContinued(String code) {
        return code.endsWith(CONTINUATION) || code.equals("_");
    }

    private static String dropMarker(String code) {
        return code.substring(0, code.length() - 1).trim();
    }

    private static void appendPart(StringBuilder sb, String part) {
        if (part.isEmpty()) return;
        if (sb.length() > 0) sb.append(' ');
        sb.append(part);
    }
}
