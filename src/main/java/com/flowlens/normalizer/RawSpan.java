package com.flowlens.normalizer;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Format-neutral view of a wire span, before field resolution.
 */
@Value
@Builder
class RawSpan {
    String spanId;
    String parentSpanId;
    String name;
    Long startTime;
    long duration;
    boolean error;
    // Attribute maps, most specific first
    List<Map<String, String>> scopes;
    String fallbackServiceName;
}
