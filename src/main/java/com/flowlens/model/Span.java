package com.flowlens.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One traced unit of work, as produced by a {@link com.flowlens.normalizer.SpanNormalizer}.
 * Timestamps and durations are epoch microseconds.
 */
@Value
@Builder(toBuilder = true)
public class Span {
    String spanId;
    String parentSpanId;
    String operationName;
    Long startTime;
    long duration;
    @Builder.Default
    SpanStatus status = SpanStatus.OK;
    String serviceName;
    String namespace;
    String podName;
    String serviceVersion;
    String environment;
    @Singular
    Map<String, String> attributes;

    public String nodeId() {
        return namespace + "/" + serviceName;
    }

    public boolean isError() {
        return status != null && status.isError();
    }
}
