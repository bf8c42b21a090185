package com.memorybench.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * {@code capabilities.system_flags}: indexing behaviour. {@code processing_latency} and
 * {@code convergence_wait_ms} are optional non-negative integers (milliseconds).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SystemFlags extends ExtensibleJsonObject {

    private final boolean asyncIndexing;
    private final Integer processingLatency;
    private final Integer convergenceWaitMs;

    @JsonCreator
    public SystemFlags(
            @JsonProperty("async_indexing") boolean asyncIndexing,
            @JsonProperty("processing_latency") Integer processingLatency,
            @JsonProperty("convergence_wait_ms") Integer convergenceWaitMs) {
        this.asyncIndexing = asyncIndexing;
        this.processingLatency = processingLatency;
        this.convergenceWaitMs = convergenceWaitMs;
    }

    @JsonProperty("async_indexing")
    public boolean isAsyncIndexing() {
        return asyncIndexing;
    }

    @JsonProperty("processing_latency")
    public Integer getProcessingLatency() {
        return processingLatency;
    }

    @JsonProperty("convergence_wait_ms")
    public Integer getConvergenceWaitMs() {
        return convergenceWaitMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SystemFlags that = (SystemFlags) o;
        return asyncIndexing == that.asyncIndexing && Objects.equals(processingLatency, that.processingLatency)
                && Objects.equals(convergenceWaitMs, that.convergenceWaitMs)
                && Objects.equals(getExtensions(), that.getExtensions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(asyncIndexing, processingLatency, convergenceWaitMs, getExtensions());
    }
}
