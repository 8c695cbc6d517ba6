package com.flowlens.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one collection cycle.
 */
@Data
@Builder
public class CollectionResult {
    private boolean started;
    private int fetched;
    private int analyzed;
    private int skipped;
    private int failed;
    private List<String> namespaces;

    public static CollectionResult notStarted() {
        return CollectionResult.builder().started(false).namespaces(List.of()).build();
    }
}
