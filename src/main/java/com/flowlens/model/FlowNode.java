package com.flowlens.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FlowNode {
    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    String id;
    ServiceInfo service;
    NodeMetrics metrics;
    String status;
}
