package com.vbaflow.analyzer.static_analysis;

import com.vbaflow.analyzer.ir.CfgModel.CallSite;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds call sites on a statement line and resolves them against the project's symbol table.
 *
 * Three call shapes are recognized: {@code Call [Module.]Proc}, {@code Module.Proc(} where
 * Module is a known module, and a bare {@code Name(} that is not a keyword, intrinsic or
 * local variable. A statement consisting of a declared procedure name followed by arguments
 * ({@code DoWork a, b}) is also a call.
 */
public class CallSiteDetector {

    private static final Pattern EXPLICIT = Pattern.compile(
        "^Call\\s+(?:([A-Za-z_][A-Za-z0-9_]*)\\.)?([A-Za-z_][A-Za-z0-9_]*)", Pattern.CASE_INSENSITIVE);

    private static final Pattern QUALIFIED = Pattern.compile(
        "(?<![A-Za-z0-9_.])([A-Za-z_][A-Za-z0-9_]*)\\.([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");

    private static final Pattern BARE = Pattern.compile(
        "(?<![A-Za-z0-9_.])([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");

    private static final Pattern BARE_STATEMENT = Pattern.compile(
        "^(?:([A-Za-z_][A-Za-z0-9_]*)\\.)?([A-Za-z_][A-Za-z0-9_]*)(?:\\s+(?!=)\\S.*)?$");

    private static final Pattern ASSIGNMENT = Pattern.compile(
        "^(?:(?:Set|Let)\\s+)?[A-Za-z_][A-Za-z0-9_.]*\\s*(?:\\([^)]*\\))?\\s*=", Pattern.CASE_INSENSITIVE);

    private static final Pattern DECLARATION = Pattern.compile(
        "^(?:Dim|ReDim|Const|Static|Private|Public|Global)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern DECLARED_NAMES = Pattern.compile(
        "(?:^(?:Dim|ReDim(?:\\s+Preserve)?|Static|Const)\\s+|,\\s*)([A-Za-z_][A-Za-z0-9_]*)", Pattern.CASE_INSENSITIVE);

    private static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"]*\"");

    /** Keywords and VBA/Excel intrinsics that look like calls but never name a user procedure. */
    static final Set<String> NON_CALLS = caseInsensitive(List.of(
        // statements and operators
        "If", "Then", "Else", "ElseIf", "And", "Or", "Not", "Xor", "Eqv", "Imp", "Mod", "Is", "Like",
        "New", "Dim", "ReDim", "Preserve", "Set", "Let", "Call", "Do", "Loop", "While", "Wend", "Until",
        "For", "Each", "In", "Next", "To", "Step", "Select", "Case", "With", "End", "Sub", "Function",
        "Property", "Exit", "GoTo", "GoSub", "On", "Error", "Resume", "Return", "Const", "Static",
        "Private", "Public", "Friend", "Global", "As", "ByVal", "ByRef", "Optional", "ParamArray",
        "Debug", "Print", "Open", "Close", "Input", "Line", "Write", "Get", "Put", "Erase", "Stop",
        "TypeOf", "Nothing", "True", "False", "Empty", "Null", "Me", "DoEvents",
        // conversion and string intrinsics
        "CBool", "CByte", "CCur", "CDate", "CDbl", "CDec", "CInt", "CLng", "CLngLng", "CLngPtr", "CSng",
        "CStr", "CVar", "CVErr", "Str", "Val", "Len", "LenB", "Left", "Right", "Mid", "LeftB", "RightB",
        "MidB", "Trim", "LTrim", "RTrim", "UCase", "LCase", "InStr", "InStrRev", "Replace", "Split",
        "Join", "Format", "FormatNumber", "FormatDateTime", "StrConv", "StrComp", "StrReverse", "Space",
        "String", "Chr", "ChrW", "Asc", "AscW", "Hex", "Oct",
        // predicates, arrays, math, dates
        "IsNumeric", "IsEmpty", "IsNull", "IsDate", "IsArray", "IsObject", "IsMissing", "IsError",
        "UBound", "LBound", "Array", "Filter", "Abs", "Int", "Fix", "Round", "Sqr", "Rnd", "Sgn", "Exp",
        "Log", "Sin", "Cos", "Tan", "Atn", "Now", "Date", "Time", "Timer", "Year", "Month", "Day", "Hour",
        "Minute", "Second", "Weekday", "DateAdd", "DateDiff", "DatePart", "DateSerial", "DateValue",
        "TimeSerial", "TimeValue", "MonthName", "WeekdayName",
        // environment and objects
        "MsgBox", "InputBox", "Dir", "Environ", "CreateObject", "GetObject", "TypeName", "VarType",
        "IIf", "Choose", "Switch", "Nz", "RGB", "QBColor", "Shell", "FreeFile", "EOF", "LOF", "Kill",
        "MkDir", "RmDir", "FileCopy", "FileLen", "FileDateTime", "CurDir", "ChDir",
        // Excel object model members commonly written unqualified
        "Range", "Cells", "Rows", "Columns", "Worksheets", "Sheets", "Workbooks", "Application",
        "ActiveSheet", "ActiveWorkbook", "ThisWorkbook", "Evaluate", "Union", "Intersect"
    ));

    private final Set<String> ignored;

    public CallSiteDetector() {
        this(List.of());
    }

    /**
     * @param extraIgnored additional bare names never treated as call sites
     */
    public CallSiteDetector(Collection<String> extraIgnored) {
        this.ignored = caseInsensitive(NON_CALLS);
        this.ignored.addAll(extraIgnored);
    }

    /**
     * Detect and resolve call sites on one statement line.
     *
     * @param code           normalized statement text
     * @param line           source line for the records
     * @param currentModule  module containing the statement
     * @param table          project symbol table
     * @param localNames     names declared locally in the enclosing procedure (arrays, variables)
     */
    public List<CallSite> detect(String code, int line, String currentModule,
                                 SymbolTable table, Set<String> localNames) {
        List<CallSite> calls = new ArrayList<>();
        String text = STRING_LITERAL.matcher(code.trim()).replaceAll("\"\"");
        if (DECLARATION.matcher(text).find()) return calls;

        Set<Integer> claimed = new HashSet<>();

        Matcher explicit = EXPLICIT.matcher(text);
        if (explicit.find()) {
            calls.add(resolve(explicit.group(1), explicit.group(2), line, currentModule, table));
            claimed.add(explicit.start(2));
            if (explicit.group(1) != null) claimed.add(explicit.start(1));
        }

        int scanFrom = 0;
        if (!calls.isEmpty()) {
            scanFrom = explicit.end();
        } else {
            Matcher assignment = ASSIGNMENT.matcher(text);
            if (assignment.find()) scanFrom = assignment.end();
        }

        Matcher qualified = QUALIFIED.matcher(text);
        qualified.region(scanFrom, text.length());
        while (qualified.find()) {
            String module = qualified.group(1);
            if (!table.hasModule(module) || claimed.contains(qualified.start(2))) continue;
            calls.add(resolve(module, qualified.group(2), line, currentModule, table));
            claimed.add(qualified.start(1));
            claimed.add(qualified.start(2));
        }

        Matcher bare = BARE.matcher(text);
        bare.region(scanFrom, text.length());
        while (bare.find()) {
            String name = bare.group(1);
            if (claimed.contains(bare.start(1))) continue;
            if (ignored.contains(name) || localNames.contains(name)) continue;
            calls.add(resolve(null, name, line, currentModule, table));
            claimed.add(bare.start(1));
        }

        if (calls.isEmpty()) {
            Matcher statement = BARE_STATEMENT.matcher(text);
            if (statement.matches()) {
                String module = statement.group(1);
                String name = statement.group(2);
                boolean candidate = module != null
                    ? table.hasModule(module)
                    : !ignored.contains(name) && !localNames.contains(name);
                if (candidate) {
                    CallSite site = resolve(module, name, line, currentModule, table);
                    // Without parentheses only a declared procedure counts as a call
                    if (site.resolved) calls.add(site);
                }
            }
        }
        return calls;
    }

    /**
     * Resolve a call target. Qualified targets are checked against that module only; bare
     * targets prefer the current module, then the first declaring module, else stay unresolved.
     */
    public CallSite resolve(String qualifier, String name, int line, String currentModule, SymbolTable table) {
        if (qualifier != null) {
            if (table.declares(qualifier, name)) {
                String module = table.canonicalModuleName(qualifier).orElse(qualifier);
                return new CallSite(module + "." + table.canonicalProcedureName(module, name), true, line);
            }
            return new CallSite(qualifier + "." + name, false, line);
        }
        if (table.declares(currentModule, name)) {
            String module = table.canonicalModuleName(currentModule).orElse(currentModule);
            return new CallSite(module + "." + table.canonicalProcedureName(module, name), true, line);
        }
        Optional<String> declaring = table.findDeclaringModule(name);
        if (declaring.isPresent()) {
            String module = declaring.get();
            return new CallSite(module + "." + table.canonicalProcedureName(module, name), true, line);
        }
        return new CallSite(name, false, line);
    }

    /**
     * Names declared by Dim/ReDim/Static/Const statements among {@code lines}.
     */
    public static Set<String> localDeclarations(Collection<LogicalLine> lines) {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (LogicalLine line : lines) {
            String code = line.code();
            if (!code.regionMatches(true, 0, "Dim", 0, 3)
                    && !code.regionMatches(true, 0, "ReDim", 0, 5)
                    && !code.regionMatches(true, 0, "Static", 0, 6)
                    && !code.regionMatches(true, 0, "Const", 0, 5)) {
                continue;
            }
            String withoutParens = code.replaceAll("\\([^)]*\\)", "");
            Matcher m = DECLARED_NAMES.matcher(withoutParens);
            while (m.find()) {
                names.add(m.group(1));
            }
        }
        return names;
    }

    private static Set<String> caseInsensitive(Collection<String> values) {
        Set<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        set.addAll(values);
        return set;
    }
}
