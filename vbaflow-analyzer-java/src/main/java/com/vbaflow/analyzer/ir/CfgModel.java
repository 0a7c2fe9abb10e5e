package com.vbaflow.analyzer.ir;

import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.List;

/**
 * POJOs for the CFG document exchanged with host tooling.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class CfgModel {

    private CfgModel() {}

    public enum NodeType {
        @SerializedName("start")   START,
        @SerializedName("end")     END,
        @SerializedName("op")      OP,
        @SerializedName("cond")    COND,
        @SerializedName("loop")    LOOP,
        @SerializedName("loopEnd") LOOP_END,
        @SerializedName("join")    JOIN,
        @SerializedName("switch")  SWITCH,
        @SerializedName("case")    CASE,
        @SerializedName("call")    CALL,
        @SerializedName("label")   LABEL,
        @SerializedName("goto")    GOTO,
        @SerializedName("block")   BLOCK,
        @SerializedName("spacer")  SPACER
    }

    public static class CfgDocument {
        @SerializedName("module_name") public String moduleName;
        @SerializedName("procedures")  public List<CfgProcedure> procedures;
        @SerializedName("call_graph")  public CallGraph callGraph;
    }

    public static class CfgProcedure {
        @SerializedName("name")       public String name;
        @SerializedName("kind")       public String kind;       // Sub, Function, Property Get/Let/Set
        @SerializedName("start_line") public int startLine;
        @SerializedName("end_line")   public int endLine;
        @SerializedName("nodes")      public List<CfgNode> nodes = new ArrayList<>();
        @SerializedName("edges")      public List<CfgEdge> edges = new ArrayList<>();
        @SerializedName("calls")      public List<CallSite> calls = new ArrayList<>();
        @SerializedName("loop_spans") public List<LoopSpan> loopSpans = new ArrayList<>();
    }

    public static class CfgNode {
        @SerializedName("id")          public String id;
        @SerializedName("type")        public NodeType type;
        @SerializedName("text")        public String text;
        @SerializedName("source_line") public int sourceLine;
        @SerializedName("comment")     public String comment;   // nullable

        public CfgNode() {}

        public CfgNode(String id, NodeType type, String text, int sourceLine, String comment) {
            this.id = id;
            this.type = type;
            this.text = text;
            this.sourceLine = sourceLine;
            this.comment = comment;
        }
    }

    public static class CfgEdge {
        @SerializedName("from")  public String from;
        @SerializedName("to")    public String to;
        @SerializedName("label") public String label;  // "", Yes, No, next, loop, exit, goto or Case text

        public CfgEdge() {}

        public CfgEdge(String from, String to, String label) {
            this.from = from;
            this.to = to;
            this.label = label;
        }
    }

    public static class CallSite {
        @SerializedName("target")      public String target;    // Module.Proc, or the bare name when unresolved
        @SerializedName("resolved")    public boolean resolved;
        @SerializedName("source_line") public int sourceLine;

        public CallSite() {}

        public CallSite(String target, boolean resolved, int sourceLine) {
            this.target = target;
            this.resolved = resolved;
            this.sourceLine = sourceLine;
        }
    }

    public static class LoopSpan {
        @SerializedName("head_id")    public String headId;
        @SerializedName("end_id")     public String endId;
        @SerializedName("start_line") public int startLine;
        @SerializedName("end_line")   public int endLine;

        public LoopSpan() {}

        public LoopSpan(String headId, String endId, int startLine, int endLine) {
            this.headId = headId;
            this.endId = endId;
            this.startLine = startLine;
            this.endLine = endLine;
        }
    }

    public static class CallGraph {
        @SerializedName("nodes") public List<String> nodes = new ArrayList<>();
        @SerializedName("edges") public List<CallGraphEdge> edges = new ArrayList<>();
    }

    public static class CallGraphEdge {
        @SerializedName("from")        public String from;
        @SerializedName("to")          public String to;
        @SerializedName("resolved")    public boolean resolved;
        @SerializedName("source_line") public int sourceLine;
    }
}
