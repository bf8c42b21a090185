package com.memorybench.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** {@code capabilities.intelligence_flags}: extraction and graph support. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IntelligenceFlags extends ExtensibleJsonObject {

    private final boolean autoExtraction;
    private final boolean graphSupport;
    private final String graphType;

    @JsonCreator
    public IntelligenceFlags(
            @JsonProperty("auto_extraction") boolean autoExtraction,
            @JsonProperty("graph_support") boolean graphSupport,
            @JsonProperty("graph_type") String graphType) {
        this.autoExtraction = autoExtraction;
        this.graphSupport = graphSupport;
        this.graphType = graphType;
    }

    @JsonProperty("auto_extraction")
    public boolean isAutoExtraction() {
        return autoExtraction;
    }

    @JsonProperty("graph_support")
    public boolean isGraphSupport() {
        return graphSupport;
    }

    /** Graph flavour (e.g. "knowledge", "temporal"); null when not declared. */
    @JsonProperty("graph_type")
    public String getGraphType() {
        return graphType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntelligenceFlags that = (IntelligenceFlags) o;
        return autoExtraction == that.autoExtraction && graphSupport == that.graphSupport
                && Objects.equals(graphType, that.graphType)
                && Objects.equals(getExtensions(), that.getExtensions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(autoExtraction, graphSupport, graphType, getExtensions());
    }
}
