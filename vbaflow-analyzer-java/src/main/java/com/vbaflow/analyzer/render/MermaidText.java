package com.vbaflow.analyzer.render;

/**
 * Escaping rules for Mermaid flowchart markup.
 */
final class MermaidText {

    private MermaidText() {}

    /**
     * Diagram identifier: ASCII letters, digits and underscore are kept, every other
     * character becomes {@code _xHEX_}. Distinct inputs stay distinct.
     */
    static String id(String prefix, String raw) {
        StringBuilder sb = new StringBuilder(prefix);
        raw.codePoints().forEach(cp -> {
            if ((cp >= 'A' && cp <= 'Z') || (cp >= 'a' && cp <= 'z') || (cp >= '0' && cp <= '9')) {
                sb.appendCodePoint(cp);
            } else if (cp == '_') {
                sb.append("__");
            } else {
                sb.append("_x").append(Integer.toHexString(cp).toUpperCase()).append('_');
            }
        });
        return sb.toString();
    }

    /**
     * Label text for use inside quotes or between edge pipes. Only characters that are
     * structural in Mermaid are replaced; other text, including non-Latin scripts, is kept.
     */
    static String label(String raw) {
        if (raw == null) return "";
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '"' -> sb.append("#quot;");
                case '[' -> sb.append("#91;");
                case ']' -> sb.append("#93;");
                case '{' -> sb.append("#123;");
                case '}' -> sb.append("#125;");
                case '|' -> sb.append("#124;");
                case '<' -> sb.append("#lt;");
                case '>' -> sb.append("#gt;");
                case '\r', '\n', '\t' -> sb.append(' ');
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
