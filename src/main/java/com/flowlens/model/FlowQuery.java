package com.flowlens.model;

import lombok.Builder;
import lombok.Data;

/**
 * Filters for listing flows. Every field is optional.
 */
@Data
@Builder
public class FlowQuery {
    private String operationName;
    private String namespace;
    private Long startTime;
    private Long endTime;
    private String environment;
    private Integer limit;

    public static FlowQuery all() {
        return FlowQuery.builder().build();
    }
}
