package com.flowlens.model;

import lombok.Builder;
import lombok.Data;

/**
 * Cluster-wide, cumulative record of calls between two services across all analyzed traces.
 */
@Data
@Builder(toBuilder = true)
public class DependencyEdge {
    private String sourceNamespace;
    private String sourceService;
    private String targetNamespace;
    private String targetService;
    private long callCount;
    private long errorCount;
    private long totalLatency;
    private long lastSeen;

    public String sourceId() {
        return sourceNamespace + "/" + sourceService;
    }

    public String targetId() {
        return targetNamespace + "/" + targetService;
    }
}
