package com.cellsafety.analysis.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of a cellsafety.json configuration document.
 * Every field is optional; getters apply the defaults.
 */
public class CellSafetyConfig {

    /** Prefix of the synthetic code name given to each instrumented cell (default: "<cell-"). */
    @SerializedName("code_name_prefix")
    private String codeNamePrefix;

    /** Whether subscript accesses are instrumented alongside attributes (default: true). */
    @SerializedName("trace_subscripts")
    private Boolean traceSubscripts;

    /** Whether call-position loads are considered for in-place mutation detection (default: true). */
    @SerializedName("track_mutations")
    private Boolean trackMutations;

    /** Name given to namespaces of objects no tracked binding refers to (default: "<unknown namespace>"). */
    @SerializedName("unknown_namespace_name")
    private String unknownNamespaceName;

    public static CellSafetyConfig defaults() {
        return new CellSafetyConfig();
    }

    public String getCodeNamePrefix()       { return codeNamePrefix != null ? codeNamePrefix : "<cell-"; }
    public boolean isTraceSubscripts()      { return traceSubscripts == null || traceSubscripts; }
    public boolean isTrackMutations()       { return trackMutations == null || trackMutations; }
    public String getUnknownNamespaceName() {
        return unknownNamespaceName != null ? unknownNamespaceName : "<unknown namespace>";
    }

    public CellSafetyConfig withTraceSubscripts(boolean enabled) {
        CellSafetyConfig copy = copy();
        copy.traceSubscripts = enabled;
        return copy;
    }

    public CellSafetyConfig withTrackMutations(boolean enabled) {
        CellSafetyConfig copy = copy();
        copy.trackMutations = enabled;
        return copy;
    }

    private CellSafetyConfig copy() {
        CellSafetyConfig copy = new CellSafetyConfig();
        copy.codeNamePrefix = codeNamePrefix;
        copy.traceSubscripts = traceSubscripts;
        copy.trackMutations = trackMutations;
        copy.unknownNamespaceName = unknownNamespaceName;
        return copy;
    }
}
