package com.flowlens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NormalizedTrace {
    String traceId;
    List<Span> spans;
    @Builder.Default
    String operationName = "unknown";
    String uiEvent;
}
