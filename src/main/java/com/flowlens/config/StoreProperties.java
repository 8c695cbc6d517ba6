package com.flowlens.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bounds for the in-memory flow store. Zero means unbounded.
 */
@Data
@ConfigurationProperties(prefix = "flowlens.store")
public class StoreProperties {
    private int maxFlowGraphs = 5000;
    private int maxDependencyEdges = 10000;
}
