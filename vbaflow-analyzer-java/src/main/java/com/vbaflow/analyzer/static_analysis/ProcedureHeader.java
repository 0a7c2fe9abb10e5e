package com.vbaflow.analyzer.static_analysis;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Procedure header/footer recognition shared by the symbol table scan and the segmenter.
 *
 *   [Public|Private|Friend] [Static] Sub|Function|Property Get/Let/Set &lt;name&gt;(
 */
public record ProcedureHeader(String name, String kind, String visibility) {

    private static final Pattern HEADER = Pattern.compile(
        "^(?:(Public|Private|Friend)\\s+)?(?:Static\\s+)?(Sub|Function|Property\\s+(?:Get|Let|Set))\\s+"
            + "([A-Za-z_][A-Za-z0-9_]*)\\s*\\(",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern FOOTER = Pattern.compile(
        "^End\\s+(Sub|Function|Property)\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern MODULE_NAME = Pattern.compile(
        "^Attribute\\s+VB_Name\\s*=\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);

    /**
     * Match a normalized statement line against the header pattern.
     */
    public static Optional<ProcedureHeader> match(String code) {
        Matcher m = HEADER.matcher(code);
        if (!m.find()) return Optional.empty();
        String visibility = m.group(1) != null ? capitalize(m.group(1)) : "Public";
        return Optional.of(new ProcedureHeader(m.group(3), canonicalKind(m.group(2)), visibility));
    }

    public static boolean isFooter(String code) {
        return FOOTER.matcher(code).matches();
    }

    /**
     * The declared module name from an {@code Attribute VB_Name = "..."} line, if this is one.
     */
    public static Optional<String> moduleNameAttribute(String code) {
        Matcher m = MODULE_NAME.matcher(code);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /** "property   get" -> "Property Get" */
    static String canonicalKind(String rawKind) {
        String[] parts = rawKind.trim().split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(capitalize(part));
        }
        return sb.toString();
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) return word;
        return Character.toUpperCase(word.charAt(0)) + word.substring(1).toLowerCase();
    }
}
