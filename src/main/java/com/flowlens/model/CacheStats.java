package com.flowlens.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CacheStats {
    private int flowGraphsCount;
    private int dependenciesCount;
    private long evictedFlowGraphs;
    private long evictedDependencies;
}
