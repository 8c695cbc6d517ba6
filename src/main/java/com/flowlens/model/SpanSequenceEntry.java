package com.flowlens.model;

import lombok.Builder;
import lombok.Value;

/**
 * A span as shown on the flow timeline.
 */
@Value
@Builder
public class SpanSequenceEntry {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    String spanId;
    String parentSpanId;
    String operationName;
    long startTime;
    long duration;
    long endTime;
    String podName;
    String serviceName;
    String namespace;
    String nodeId;
    String status;
}
