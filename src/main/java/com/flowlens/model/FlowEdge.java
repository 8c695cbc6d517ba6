package com.flowlens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FlowEdge {
    String from;
    String to;
    int callCount;
    int errorCount;
    long totalLatency;
    List<Long> latencies;
    double errorRate;
    long avgLatency;

    public String key() {
        return from + "->" + to;
    }
}
