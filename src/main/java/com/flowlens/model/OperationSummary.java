package com.flowlens.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OperationSummary {
    private String name;
    private int flowCount;
    private long lastStartTime;
}
