package com.flowlens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NodeMetrics {
    int requestCount;
    int errorCount;
    long totalLatency;
    List<Long> latencies;
    long avgLatency;
    long p50Latency;
    long p95Latency;
    long p99Latency;
}
