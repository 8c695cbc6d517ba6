package com.flowlens.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class CollectorStatus {
    private boolean enabled;
    private boolean collecting;
    private long intervalMs;
    private String backend;
    private List<String> allowedNamespaces;
    private Instant lastCollectionAt;
    private CollectionResult lastResult;
    private String lastError;
}
