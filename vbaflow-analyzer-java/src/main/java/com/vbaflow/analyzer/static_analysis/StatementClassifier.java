package com.vbaflow.analyzer.static_analysis;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one normalized statement line by pattern match. First match wins, in the order
 * of {@link Kind}'s declaration; anything unmatched is a plain {@link Kind#STATEMENT}.
 */
public class StatementClassifier {

    public enum Kind {
        SINGLE_LINE_IF,
        IF, ELSE_IF, ELSE, END_IF,
        DO, LOOP, WHILE, WEND,
        FOR, NEXT,
        SELECT, CASE_ELSE, CASE, END_SELECT,
        WITH, END_WITH,
        GOTO,
        LABEL,
        EXIT_LOOP,
        EXIT,
        STATEMENT
    }

    /**
     * A classified line. {@code arg1}/{@code arg2} carry the captured parts, e.g. the condition
     * and the trailing statement of a single-line If. Either may be null.
     */
    public record Statement(Kind kind, String text, String arg1, String arg2) {}

    private record Rule(Kind kind, Pattern pattern) {}

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final List<Rule> RULES = List.of(
        new Rule(Kind.SINGLE_LINE_IF, Pattern.compile("^If\\s+(.+?)\\s+Then\\s+(\\S.*)$", FLAGS)),
        new Rule(Kind.IF,          Pattern.compile("^If\\s+(.+?)\\s+Then$", FLAGS)),
        new Rule(Kind.ELSE_IF,     Pattern.compile("^ElseIf\\s+(.+?)\\s+Then(?:\\s+(\\S.*))?$", FLAGS)),
        new Rule(Kind.ELSE,        Pattern.compile("^Else:?(?:\\s+(\\S.*))?$", FLAGS)),
        new Rule(Kind.END_IF,      Pattern.compile("^End\\s*If$", FLAGS)),
        new Rule(Kind.DO,          Pattern.compile("^Do(?:\\s+(While|Until)\\s+(.+))?$", FLAGS)),
        new Rule(Kind.LOOP,        Pattern.compile("^Loop(?:\\s+(While|Until)\\s+(.+))?$", FLAGS)),
        new Rule(Kind.WHILE,       Pattern.compile("^While\\s+(.+)$", FLAGS)),
        new Rule(Kind.WEND,        Pattern.compile("^Wend$", FLAGS)),
        new Rule(Kind.FOR,         Pattern.compile("^For\\s+(.+)$", FLAGS)),
        new Rule(Kind.NEXT,        Pattern.compile("^Next(?:\\s+(.*))?$", FLAGS)),
        new Rule(Kind.SELECT,      Pattern.compile("^Select\\s+Case\\s+(.+)$", FLAGS)),
        new Rule(Kind.END_SELECT,  Pattern.compile("^End\\s+Select$", FLAGS)),
        new Rule(Kind.WITH,        Pattern.compile("^With\\s+(.+)$", FLAGS)),
        new Rule(Kind.END_WITH,    Pattern.compile("^End\\s+With$", FLAGS)),
        new Rule(Kind.GOTO,        Pattern.compile("^GoTo\\s+([A-Za-z_][A-Za-z0-9_]*|\\d+)$", FLAGS)),
        new Rule(Kind.LABEL,       Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*|\\d+):(?:\\s+(\\S.*))?$", FLAGS)),
        new Rule(Kind.EXIT_LOOP,   Pattern.compile("^Exit\\s+(Do|For)$", FLAGS)),
        new Rule(Kind.EXIT,        Pattern.compile("^(Exit\\s+(?:Sub|Function|Property)|End|Return|Err\\.Raise\\b.*)$", FLAGS))
    );

    private static final Pattern CASE_LINE = Pattern.compile("^Case\\s+(.+)$", FLAGS);

    public Statement classify(String code) {
        String text = code.trim();
        Matcher caseLine = CASE_LINE.matcher(text);
        if (caseLine.matches()) {
            return caseArm(text, caseLine.group(1));
        }
        for (Rule rule : RULES) {
            Matcher m = rule.pattern().matcher(text);
            if (m.matches()) {
                String arg1 = m.groupCount() >= 1 ? m.group(1) : null;
                String arg2 = m.groupCount() >= 2 ? m.group(2) : null;
                return new Statement(rule.kind(), text, trimOrNull(arg1), trimOrNull(arg2));
            }
        }
        return new Statement(Kind.STATEMENT, text, null, null);
    }

    /**
     * {@code Case 1, 2: Foo} keeps the label in arg1 and the statement after the colon in arg2.
     * {@code Case Else} has no arg1.
     */
    private static Statement caseArm(String text, String rest) {
        int colon = separatorIndex(rest);
        String caseLabel = colon < 0 ? rest : rest.substring(0, colon);
        String inline = colon < 0 ? null : rest.substring(colon + 1);
        if (caseLabel.trim().equalsIgnoreCase("Else")) {
            return new Statement(Kind.CASE_ELSE, text, null, trimOrNull(inline));
        }
        return new Statement(Kind.CASE, text, trimOrNull(caseLabel), trimOrNull(inline));
    }

    /** First statement-separating colon outside string literals, or -1. */
    private static int separatorIndex(String code) {
        boolean inString = false;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (c == ':' && !inString && (i + 1 >= code.length() || code.charAt(i + 1) != '=')) {
                return i;
            }
        }
        return -1;
    }

    private static String trimOrNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
