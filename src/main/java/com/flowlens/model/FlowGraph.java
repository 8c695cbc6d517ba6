package com.flowlens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Reconstructed call graph of a single trace.
 */
@Value
@Builder
public class FlowGraph {
    String flowId;
    String traceId;
    String operationName;
    String uiEvent;
    long startTime;
    long endTime;
    long duration;
    List<FlowNode> nodes;
    List<FlowEdge> edges;
    List<SpanSequenceEntry> spanSequence;
    FlowMetadata metadata;

    public boolean hasNamespace(String namespace) {
        return nodes.stream()
                .map(node -> node.getService().getNamespace())
                .anyMatch(namespace::equalsIgnoreCase);
    }
}
