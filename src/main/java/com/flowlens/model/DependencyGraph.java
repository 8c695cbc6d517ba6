package com.flowlens.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DependencyGraph {
    private List<Node> nodes;
    private List<Edge> edges;

    @Data
    @Builder
    public static class Node {
        private String id;
        private ServiceInfo service;
    }

    @Data
    @Builder
    public static class Edge {
        private String from;
        private String to;
        private long callCount;
        private long errorCount;
        private double errorRate;
        private long avgLatency;
        private long lastSeen;
    }
}
