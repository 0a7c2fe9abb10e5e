package com.vbaflow.analyzer.static_analysis;

import com.vbaflow.analyzer.ir.CfgModel.CallSite;
import com.vbaflow.analyzer.ir.CfgModel.CfgEdge;
import com.vbaflow.analyzer.ir.CfgModel.CfgNode;
import com.vbaflow.analyzer.ir.CfgModel.CfgProcedure;
import com.vbaflow.analyzer.ir.CfgModel.LoopSpan;
import com.vbaflow.analyzer.ir.CfgModel.NodeType;
import com.vbaflow.analyzer.static_analysis.ProcedureSegmenter.ProcedureSlice;
import com.vbaflow.analyzer.static_analysis.StatementClassifier.Kind;
import com.vbaflow.analyzer.static_analysis.StatementClassifier.Statement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Builds the control-flow graph of one procedure in a single forward pass over its statements.
 *
 * Each classified line is folded into the graph by a handler that receives the current
 * {@link Cursor} (the node the next statement connects from) and returns the new one.
 * A null cursor means control cannot fall through: statements after it start a new,
 * unconnected chain.
 *
 * Node ids are "L&lt;line&gt;", with "_1", "_2", ... appended when one line yields several
 * nodes. The entry and final exit nodes are "start" and "end".
 */
public class ControlFlowBuilder {

    public static final String START_ID = "start";
    public static final String END_ID = "end";

    private static final Pattern NESTED_IF = Pattern.compile("^If\\s", Pattern.CASE_INSENSITIVE);

    /**
     * Node the next emitted node connects from, and the label that edge carries.
     */
    public record Cursor(String nodeId, String label) {
        public static Cursor at(String nodeId) {
            return new Cursor(nodeId, "");
        }
    }

    private final StatementClassifier classifier = new StatementClassifier();
    private final CallSiteDetector callSiteDetector;

    public ControlFlowBuilder() {
        this(new CallSiteDetector());
    }

    public ControlFlowBuilder(CallSiteDetector callSiteDetector) {
        this.callSiteDetector = callSiteDetector;
    }

    /**
     * Build the CFG, call sites and loop spans of one procedure.
     *
     * @param slice       the procedure's header data and body lines
     * @param moduleName  declared name of the module containing the procedure
     * @param table       symbol table of the whole project, used for call resolution
     */
    public CfgProcedure build(ProcedureSlice slice, String moduleName, SymbolTable table) {
        Walk walk = new Walk(slice, moduleName, table,
            CallSiteDetector.localDeclarations(slice.body()));
        Cursor cursor = walk.start();
        for (LogicalLine line : slice.body()) {
            if (line.isBlank()) continue;
            walk.beginLine(line);
            cursor = walk.accept(classifier.classify(line.code()), cursor);
        }
        walk.finish(cursor);
        return walk.procedure;
    }

    // --- Construct frames ---

    private abstract static class Frame {
        final String entryId;
        final int line;

        Frame(String entryId, int line) {
            this.entryId = entryId;
            this.line = line;
        }
    }

    private static final class IfFrame extends Frame {
        String condId;
        boolean elseSeen;
        final List<Cursor> tails = new ArrayList<>();

        IfFrame(String condId, int line) {
            super(condId, line);
            this.condId = condId;
        }
    }

    private enum LoopKind { DO, WHILE, FOR }

    private static final class LoopFrame extends Frame {
        final LoopKind kind;
        final List<String> exits = new ArrayList<>();

        LoopFrame(String headId, int line, LoopKind kind) {
            super(headId, line);
            this.kind = kind;
        }
    }

    private static final class SelectFrame extends Frame {
        boolean caseOpened;
        final List<Cursor> tails = new ArrayList<>();

        SelectFrame(String switchId, int line) {
            super(switchId, line);
        }
    }

    private static final class WithFrame extends Frame {
        WithFrame(String blockId, int line) {
            super(blockId, line);
        }
    }

    /**
     * Mutable state of one procedure walk. Discarded after {@link #finish}.
     */
    private final class Walk {

        final CfgProcedure procedure = new CfgProcedure();
        final String moduleName;
        final SymbolTable table;
        final Set<String> localNames;

        final Deque<Frame> frames = new ArrayDeque<>();
        final Map<String, String> labels = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        final Map<String, List<String>> pendingGotos = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        final Map<Integer, Integer> idsPerLine = new HashMap<>();

        int line;
        String pendingComment;

        Walk(ProcedureSlice slice, String moduleName, SymbolTable table, Set<String> localNames) {
            this.moduleName = moduleName;
            this.table = table;
            this.localNames = localNames;
            procedure.name = slice.name();
            procedure.kind = slice.kind();
            procedure.startLine = slice.startLine();
            procedure.endLine = slice.endLine();
        }

        Cursor start() {
            procedure.nodes.add(new CfgNode(START_ID, NodeType.START,
                procedure.kind + " " + procedure.name, procedure.startLine, null));
            return Cursor.at(START_ID);
        }

        void beginLine(LogicalLine logical) {
            line = logical.lineNumber();
            pendingComment = logical.comment();
        }

        Cursor accept(Statement stmt, Cursor cursor) {
            return switch (stmt.kind()) {
                case SINGLE_LINE_IF -> singleLineIf(stmt, cursor);
                case IF -> openIf("If " + stmt.arg1() + "?", cursor);
                case ELSE_IF -> elseIf(stmt, cursor);
                case ELSE -> elseArm(stmt, cursor);
                case END_IF -> endIf(cursor);
                case DO -> openLoop(LoopKind.DO, stmt.text(), stmt.arg1(), cursor);
                case WHILE -> openLoop(LoopKind.WHILE, stmt.text(), "While", cursor);
                case FOR -> openLoop(LoopKind.FOR, stmt.text(), null, cursor);
                case LOOP -> closeLoop(LoopKind.DO, stmt.text(), cursor);
                case WEND -> closeLoop(LoopKind.WHILE, stmt.text(), cursor);
                case NEXT -> closeLoop(LoopKind.FOR, stmt.text(), cursor);
                case SELECT -> openSelect(stmt, cursor);
                case CASE -> openCase(stmt.arg1(), stmt.arg2(), cursor);
                case CASE_ELSE -> openCase("Else", stmt.arg2(), cursor);
                case END_SELECT -> endSelect(cursor);
                case WITH -> openWith(stmt, cursor);
                case END_WITH -> endWith(cursor);
                case GOTO -> jump(stmt, cursor);
                case LABEL -> label(stmt, cursor);
                case EXIT_LOOP -> exitLoop(stmt, cursor);
                case EXIT -> exit(stmt, cursor);
                default -> statement(stmt.text(), cursor);
            };
        }

        // --- If / ElseIf / Else / End If ---

        Cursor openIf(String condText, Cursor cursor) {
            String condId = emit(NodeType.COND, condText);
            connect(cursor, condId);
            frames.push(new IfFrame(condId, line));
            return new Cursor(condId, "Yes");
        }

        Cursor elseIf(Statement stmt, Cursor cursor) {
            IfFrame frame = unwindTo(IfFrame.class::isInstance, IfFrame.class);
            if (frame == null) {
                warn("ElseIf without If; treated as If");
                return inline(stmt.arg2(), openIf("If " + stmt.arg1() + "?", cursor));
            }
            closeArm(frame.tails, cursor);
            String condId = emit(NodeType.COND, "ElseIf " + stmt.arg1() + "?");
            addEdge(frame.condId, condId, "No");
            frame.condId = condId;
            return inline(stmt.arg2(), new Cursor(condId, "Yes"));
        }

        Cursor elseArm(Statement stmt, Cursor cursor) {
            IfFrame frame = unwindTo(IfFrame.class::isInstance, IfFrame.class);
            if (frame == null) {
                warn("Else without If dropped");
                return cursor;
            }
            closeArm(frame.tails, cursor);
            frame.elseSeen = true;
            return inline(stmt.arg1(), new Cursor(frame.condId, "No"));
        }

        Cursor endIf(Cursor cursor) {
            IfFrame frame = unwindTo(IfFrame.class::isInstance, IfFrame.class);
            if (frame == null) {
                warn("End If without If dropped");
                return cursor;
            }
            frames.pop();
            closeArm(frame.tails, cursor);
            String joinId = emit(NodeType.JOIN, "End If");
            for (Cursor tail : frame.tails) {
                connect(tail, joinId);
            }
            if (!frame.elseSeen) {
                addEdge(frame.condId, joinId, "No");
            }
            return Cursor.at(joinId);
        }

        /**
         * {@code If cond Then stmt [Else stmt]} on one line: no End If will follow, so the
         * join is synthesized right after the branch statements.
         */
        Cursor singleLineIf(Statement stmt, Cursor cursor) {
            String condId = emit(NodeType.COND, "If " + stmt.arg1() + "?");
            connect(cursor, condId);

            // A nested single-line If owns the Else that follows it
            String[] arms = NESTED_IF.matcher(stmt.arg2()).find()
                ? new String[] { stmt.arg2(), null }
                : splitElse(stmt.arg2());
            Cursor yesTail = inline(arms[0], new Cursor(condId, "Yes"));
            Cursor noTail = arms[1] != null
                ? inline(arms[1], new Cursor(condId, "No"))
                : new Cursor(condId, "No");

            String joinId = emit(NodeType.JOIN, "End If");
            connect(yesTail, joinId);
            connect(noTail, joinId);
            return Cursor.at(joinId);
        }

        /**
         * Statements written after Then/Else/Case/a label on the same line. A nested single-line
         * If is expanded; block openers are not expected here and are kept as plain operations.
         */
        Cursor inline(String code, Cursor cursor) {
            if (code == null) return cursor;
            Cursor current = cursor;
            List<String> parts = splitStatements(code);
            for (int i = 0; i < parts.size(); i++) {
                Statement stmt = classifier.classify(parts.get(i));
                Kind kind = stmt.kind();
                if (kind == Kind.SINGLE_LINE_IF) {
                    // The rest of the line belongs to the nested If's branches
                    String rest = String.join(": ", parts.subList(i, parts.size()));
                    return accept(classifier.classify(rest), current);
                }
                if (kind == Kind.EXIT || kind == Kind.EXIT_LOOP || kind == Kind.GOTO || kind == Kind.STATEMENT) {
                    current = accept(stmt, current);
                } else {
                    current = statement(stmt.text(), current);
                }
            }
            return current;
        }

        // --- Do / While / For loops ---

        Cursor openLoop(LoopKind kind, String text, String keyword, Cursor cursor) {
            String headId = emit(NodeType.LOOP, text);
            connect(cursor, headId);
            frames.push(new LoopFrame(headId, line, kind));
            return new Cursor(headId, entryLabel(keyword));
        }

        Cursor closeLoop(LoopKind kind, String text, Cursor cursor) {
            LoopFrame frame = unwindTo(f -> f instanceof LoopFrame && ((LoopFrame) f).kind == kind,
                LoopFrame.class);
            if (frame == null) {
                warn("'" + text + "' without matching loop header dropped");
                return cursor;
            }
            frames.pop();
            String endId = emit(NodeType.LOOP_END, text);
            connect(cursor, endId);
            for (String exitId : frame.exits) {
                addEdge(exitId, endId, "exit");
            }
            addEdge(endId, frame.entryId, "loop");
            procedure.loopSpans.add(new LoopSpan(frame.entryId, endId, frame.line, line));
            return new Cursor(endId, "exit");
        }

        Cursor exitLoop(Statement stmt, Cursor cursor) {
            String id = emit(NodeType.GOTO, stmt.text());
            connect(cursor, id);
            LoopKind kind = "For".equalsIgnoreCase(stmt.arg1()) ? LoopKind.FOR : LoopKind.DO;
            LoopFrame target = null;
            for (Frame frame : frames) {
                if (frame instanceof LoopFrame && ((LoopFrame) frame).kind == kind) {
                    target = (LoopFrame) frame;
                    break;
                }
            }
            if (target != null) {
                target.exits.add(id);
            } else {
                warn("'" + stmt.text() + "' outside a matching loop");
            }
            return null;
        }

        // --- Select Case ---

        Cursor openSelect(Statement stmt, Cursor cursor) {
            String switchId = emit(NodeType.SWITCH, stmt.text());
            connect(cursor, switchId);
            frames.push(new SelectFrame(switchId, line));
            // Only Case arms leave the switch node
            return null;
        }

        Cursor openCase(String caseLabel, String inlineCode, Cursor cursor) {
            SelectFrame frame = unwindTo(SelectFrame.class::isInstance, SelectFrame.class);
            if (frame == null) {
                warn("Case " + caseLabel + " outside Select Case dropped");
                return inline(inlineCode, cursor);
            }
            if (frame.caseOpened) {
                closeArm(frame.tails, cursor);
            }
            frame.caseOpened = true;
            String caseId = emit(NodeType.CASE, "Case " + caseLabel);
            addEdge(frame.entryId, caseId, caseLabel);
            return inline(inlineCode, Cursor.at(caseId));
        }

        Cursor endSelect(Cursor cursor) {
            SelectFrame frame = unwindTo(SelectFrame.class::isInstance, SelectFrame.class);
            if (frame == null) {
                warn("End Select without Select Case dropped");
                return cursor;
            }
            frames.pop();
            if (frame.caseOpened) {
                closeArm(frame.tails, cursor);
            }
            String joinId = emit(NodeType.JOIN, "End Select");
            for (Cursor tail : frame.tails) {
                connect(tail, joinId);
            }
            if (!frame.caseOpened) {
                addEdge(frame.entryId, joinId, "");
            }
            return Cursor.at(joinId);
        }

        // --- With ---

        Cursor openWith(Statement stmt, Cursor cursor) {
            String blockId = emit(NodeType.BLOCK, stmt.text());
            connect(cursor, blockId);
            frames.push(new WithFrame(blockId, line));
            return Cursor.at(blockId);
        }

        Cursor endWith(Cursor cursor) {
            WithFrame frame = unwindTo(WithFrame.class::isInstance, WithFrame.class);
            if (frame == null) {
                warn("End With without With dropped");
                return cursor;
            }
            frames.pop();
            String joinId = emit(NodeType.JOIN, "End With");
            connect(cursor, joinId);
            return Cursor.at(joinId);
        }

        // --- GoTo / labels ---

        Cursor jump(Statement stmt, Cursor cursor) {
            String gotoId = emit(NodeType.GOTO, stmt.text());
            connect(cursor, gotoId);
            String target = stmt.arg1();
            String labelId = labels.get(target);
            if (labelId != null) {
                addEdge(gotoId, labelId, "goto");
            } else {
                pendingGotos.computeIfAbsent(target, k -> new ArrayList<>()).add(gotoId);
            }
            return null;
        }

        Cursor label(Statement stmt, Cursor cursor) {
            String name = stmt.arg1();
            String labelId = emit(NodeType.LABEL, name + ":");
            labels.put(name, labelId);
            List<String> waiting = pendingGotos.remove(name);
            if (waiting != null) {
                for (String gotoId : waiting) {
                    addEdge(gotoId, labelId, "goto");
                }
            }
            // A label starts a new chain; only the entry node still falls into it
            if (cursor != null && START_ID.equals(cursor.nodeId())) {
                connect(cursor, labelId);
            }
            return inline(stmt.arg2(), Cursor.at(labelId));
        }

        // --- Exit / plain statements ---

        Cursor exit(Statement stmt, Cursor cursor) {
            String id = emit(NodeType.END, stmt.text());
            connect(cursor, id);
            return null;
        }

        Cursor statement(String text, Cursor cursor) {
            List<CallSite> sites = callSiteDetector.detect(text, line, moduleName, table, localNames);
            String id = emit(sites.isEmpty() ? NodeType.OP : NodeType.CALL, text);
            connect(cursor, id);
            procedure.calls.addAll(sites);
            return Cursor.at(id);
        }

        void finish(Cursor cursor) {
            // Unterminated constructs and unresolved GoTo targets are dropped without edges
            frames.clear();
            if (cursor != null) {
                String kindWord = procedure.kind.split(" ")[0];
                procedure.nodes.add(new CfgNode(END_ID, NodeType.END, "End " + kindWord,
                    procedure.endLine, null));
                connect(cursor, END_ID);
            }
        }

        // --- Helpers ---

        String emit(NodeType type, String text) {
            int count = idsPerLine.merge(line, 1, Integer::sum);
            String id = count == 1 ? "L" + line : "L" + line + "_" + (count - 1);
            procedure.nodes.add(new CfgNode(id, type, text, line, pendingComment));
            pendingComment = null;
            return id;
        }

        void connect(Cursor from, String toId) {
            if (from == null) return;
            addEdge(from.nodeId(), toId, from.label());
        }

        void addEdge(String from, String to, String label) {
            procedure.edges.add(new CfgEdge(from, to, label != null ? label : ""));
        }

        void closeArm(List<Cursor> tails, Cursor cursor) {
            if (cursor != null) tails.add(cursor);
        }

        /**
         * Pops frames above the nearest frame matching {@code match} and returns it without
         * popping it. When no frame matches, the stack is left untouched and null is returned.
         */
        <T extends Frame> T unwindTo(Predicate<Frame> match, Class<T> type) {
            boolean present = false;
            for (Frame frame : frames) {
                if (match.test(frame)) {
                    present = true;
                    break;
                }
            }
            if (!present) return null;
            while (!match.test(frames.peek())) {
                frames.pop();
            }
            return type.cast(frames.peek());
        }

        void warn(String message) {
            System.err.println("[vba-flow] WARNING: " + moduleName + "." + procedure.name
                + " line " + line + ": " + message);
        }
    }

    private static String entryLabel(String keyword) {
        if ("While".equalsIgnoreCase(keyword)) return "Yes";
        if ("Until".equalsIgnoreCase(keyword)) return "No";
        return "";
    }

    /**
     * Splits the branch text of a single-line If into its Then and Else parts.
     */
    static String[] splitElse(String branches) {
        int idx = indexOutsideStrings(branches, "Else");
        if (idx < 0) return new String[] { branches.trim(), null };
        String thenPart = branches.substring(0, idx).trim();
        String elsePart = branches.substring(idx + 4).trim();
        return new String[] { thenPart, elsePart.isEmpty() ? null : elsePart };
    }

    /**
     * Splits {@code a = 1: b = 2} on statement separators, ignoring colons inside string
     * literals and in named arguments ({@code :=}).
     */
    static List<String> splitStatements(String code) {
        List<String> parts = new ArrayList<>();
        boolean inString = false;
        int start = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (c == ':' && !inString && (i + 1 >= code.length() || code.charAt(i + 1) != '=')) {
                String part = code.substring(start, i).trim();
                if (!part.isEmpty()) parts.add(part);
                start = i + 1;
            }
        }
        String last = code.substring(start).trim();
        if (!last.isEmpty()) parts.add(last);
        return parts;
    }

    /**
     * Index of {@code word} as a whole, whitespace-delimited word outside string literals.
     */
    private static int indexOutsideStrings(String text, String word) {
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString || !text.regionMatches(true, i, word, 0, word.length())) continue;
            boolean startOk = i > 0 && Character.isWhitespace(text.charAt(i - 1));
            int after = i + word.length();
            boolean endOk = after == text.length() || Character.isWhitespace(text.charAt(after));
            if (startOk && endOk) return i;
        }
        return -1;
    }
}
