package com.flowlens.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class OperationStats {
    private String operationName;
    private int totalRequests;
    private int successCount;
    private int errorCount;
    private long avgLatency;
    private long p50Latency;
    private long p95Latency;
    private long p99Latency;
    private Map<String, ServiceBreakdown> services;

    @Data
    @Builder
    public static class ServiceBreakdown {
        private String name;
        private int requestCount;
        private int errorCount;
    }
}
