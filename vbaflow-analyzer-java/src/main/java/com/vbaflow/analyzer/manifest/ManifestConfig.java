package com.vbaflow.analyzer.manifest;

import com.google.gson.annotations.SerializedName;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of an analysis manifest.json. Every field is optional.
 */
public class ManifestConfig {

    static final List<String> DEFAULT_EXTENSIONS = List.of(".bas", ".cls", ".frm");

    /** Folder holding the sibling module files (default: the target's folder). */
    @SerializedName("source_dir")
    private String sourceDir;

    /** Module file whose procedures are graphed. */
    @SerializedName("target")
    private String target;

    @SerializedName("output_dir")
    private String outputDir;

    /** Recognized module file extensions (default: .bas, .cls, .frm). */
    @SerializedName("extensions")
    private List<String> extensions;

    /** Charset of the exported module files (default: UTF-8). */
    @SerializedName("encoding")
    private String encoding;

    /** Extra bare names that are never call sites, e.g. project-wide array variables. */
    @SerializedName("ignored_calls")
    private List<String> ignoredCalls;

    /** Mermaid direction for procedure flowcharts (default: TD). */
    @SerializedName("flow_direction")
    private String flowDirection;

    /** Mermaid direction for call graphs (default: LR). */
    @SerializedName("call_graph_direction")
    private String callGraphDirection;

    public static ManifestConfig defaults() {
        return new ManifestConfig();
    }

    public String getSourceDir()    { return sourceDir; }
    public String getTarget()       { return target; }
    public String getOutputDir()    { return outputDir != null ? outputDir : "cfg-out"; }
    public List<String> getExtensions() {
        return extensions != null && !extensions.isEmpty() ? extensions : DEFAULT_EXTENSIONS;
    }
    public String getEncoding()     { return encoding != null ? encoding : StandardCharsets.UTF_8.name(); }
    public Charset getCharset()     { return Charset.forName(getEncoding()); }
    public List<String> getIgnoredCalls() { return ignoredCalls != null ? ignoredCalls : Collections.emptyList(); }
    public String getFlowDirection()      { return flowDirection != null ? flowDirection : "TD"; }
    public String getCallGraphDirection() { return callGraphDirection != null ? callGraphDirection : "LR"; }

    // CLI flags override manifest values

    public ManifestConfig withSourceDir(String dir) {
        if (dir != null) this.sourceDir = dir;
        return this;
    }

    public ManifestConfig withTarget(String file) {
        if (file != null) this.target = file;
        return this;
    }

    public ManifestConfig withOutputDir(String dir) {
        if (dir != null) this.outputDir = dir;
        return this;
    }
}
