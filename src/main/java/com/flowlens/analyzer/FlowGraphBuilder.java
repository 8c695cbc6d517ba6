package com.flowlens.analyzer;

import com.flowlens.model.FlowEdge;
import com.flowlens.model.FlowGraph;
import com.flowlens.model.FlowMetadata;
import com.flowlens.model.FlowNode;
import com.flowlens.model.NodeMetrics;
import com.flowlens.model.ServiceInfo;
import com.flowlens.model.Span;
import com.flowlens.model.SpanSequenceEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the service flow graph of one trace. The returned graph and every collection in it are
 * unmodifiable.
 *
 * <p>Every span contributes a request to the node of its {@code namespace/serviceName}. A span whose
 * parent belongs to a different node also contributes a call to the edge {@code parent -> child};
 * parent and child inside the same node are internal work and produce no edge. Metrics only cover
 * the given spans, aggregation across traces happens in the store.
 */
@Slf4j
@Component
public class FlowGraphBuilder {

    public static final String FLOW_ID_PREFIX = "flow-";

    /**
     * @return the flow graph, or null when there are no spans
     */
    public FlowGraph build(String traceId, List<Span> spans, String operationName, String uiEvent) {
        if (spans == null || spans.isEmpty()) {
            return null;
        }

        Map<String, NodeAccumulator> nodes = new LinkedHashMap<>();
        Map<String, Span> spansById = new HashMap<>();

        for (Span span : spans) {
            NodeAccumulator node = nodes.computeIfAbsent(span.nodeId(), id -> new NodeAccumulator(id, span));
            node.add(span);
            if (span.getSpanId() != null) {
                spansById.put(span.getSpanId(), span);
            }
        }

        Map<String, EdgeAccumulator> edges = new LinkedHashMap<>();
        for (Span span : spans) {
            if (span.getParentSpanId() == null) continue;
            Span parent = spansById.get(span.getParentSpanId());
            if (parent == null) continue;

            String from = parent.nodeId();
            String to = span.nodeId();
            if (from.equals(to)) continue;

            edges.computeIfAbsent(from + "->" + to, key -> new EdgeAccumulator(from, to)).add(span);
        }

        List<FlowNode> finalNodes = nodes.values().stream()
                .map(NodeAccumulator::toNode)
                .collect(Collectors.toUnmodifiableList());
        List<FlowEdge> finalEdges = edges.values().stream()
                .map(EdgeAccumulator::toEdge)
                .collect(Collectors.toUnmodifiableList());

        long startTime = spans.stream().mapToLong(FlowGraphBuilder::startOf).min().orElse(0L);
        long endTime = spans.stream().mapToLong(span -> startOf(span) + span.getDuration()).max().orElse(0L);

        FlowGraph flowGraph = FlowGraph.builder()
                .flowId(FLOW_ID_PREFIX + traceId)
                .traceId(traceId)
                .operationName(operationName != null ? operationName : "unknown")
                .uiEvent(uiEvent)
                .startTime(startTime)
                .endTime(endTime)
                .duration(endTime - startTime)
                .nodes(finalNodes)
                .edges(finalEdges)
                .spanSequence(spanSequence(spans))
                .metadata(metadata(spans, finalNodes))
                .build();

        log.debug("Built flow graph {} ({} nodes, {} edges, {} spans)",
                flowGraph.getFlowId(), finalNodes.size(), finalEdges.size(), spans.size());
        return flowGraph;
    }

    private static long startOf(Span span) {
        return span.getStartTime() != null ? span.getStartTime() : 0L;
    }

    private static List<SpanSequenceEntry> spanSequence(List<Span> spans) {
        return spans.stream()
                .filter(span -> span.getStartTime() != null && span.getStartTime() > 0)
                .sorted(Comparator.comparingLong(Span::getStartTime))
                .map(span -> SpanSequenceEntry.builder()
                        .spanId(span.getSpanId())
                        .parentSpanId(span.getParentSpanId())
                        .operationName(span.getOperationName())
                        .startTime(span.getStartTime())
                        .duration(span.getDuration())
                        .endTime(span.getStartTime() + span.getDuration())
                        .podName(span.getPodName())
                        .serviceName(span.getServiceName())
                        .namespace(span.getNamespace())
                        .nodeId(span.nodeId())
                        .status(span.isError() ? SpanSequenceEntry.ERROR : SpanSequenceEntry.SUCCESS)
                        .build())
                .collect(Collectors.toUnmodifiableList());
    }

    private static FlowMetadata metadata(List<Span> spans, List<FlowNode> nodes) {
        Map<String, List<String>> servicesByNamespace = new LinkedHashMap<>();
        for (FlowNode node : nodes) {
            servicesByNamespace
                    .computeIfAbsent(node.getService().getNamespace(), ns -> new ArrayList<>())
                    .add(node.getService().getName());
        }
        servicesByNamespace.replaceAll((namespace, services) -> Collections.unmodifiableList(services));

        String environment = spans.stream()
                .map(Span::getEnvironment)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);

        return FlowMetadata.builder()
                .namespace(spans.get(0).getNamespace())
                .environment(environment)
                .totalSpans(spans.size())
                .serviceCount(nodes.size())
                .errorCount(nodes.stream().mapToInt(node -> node.getMetrics().getErrorCount()).sum())
                .namespaces(Collections.unmodifiableList(new ArrayList<>(servicesByNamespace.keySet())))
                .servicesByNamespace(Collections.unmodifiableMap(servicesByNamespace))
                .build();
    }

    private static final class NodeAccumulator {
        private final String id;
        private final ServiceInfo service;
        private final List<Long> latencies = new ArrayList<>();
        private int requestCount;
        private int errorCount;
        private long totalLatency;

        NodeAccumulator(String id, Span firstSpan) {
            this.id = id;
            this.service = ServiceInfo.builder()
                    .name(firstSpan.getServiceName())
                    .namespace(firstSpan.getNamespace())
                    .pod(firstSpan.getPodName())
                    .version(firstSpan.getServiceVersion() != null ? firstSpan.getServiceVersion() : "unknown")
                    .build();
        }

        void add(Span span) {
            requestCount++;
            if (span.isError()) {
                errorCount++;
            }
            totalLatency += span.getDuration();
            latencies.add(span.getDuration());
        }

        FlowNode toNode() {
            NodeMetrics metrics = NodeMetrics.builder()
                    .requestCount(requestCount)
                    .errorCount(errorCount)
                    .totalLatency(totalLatency)
                    .latencies(List.copyOf(latencies))
                    .avgLatency(Percentiles.average(totalLatency, requestCount))
                    .p50Latency(Percentiles.nearestRank(latencies, 50))
                    .p95Latency(Percentiles.nearestRank(latencies, 95))
                    .p99Latency(Percentiles.nearestRank(latencies, 99))
                    .build();
            return FlowNode.builder()
                    .id(id)
                    .service(service)
                    .metrics(metrics)
                    .status(errorCount > 0 ? FlowNode.DEGRADED : FlowNode.HEALTHY)
                    .build();
        }
    }

    private static final class EdgeAccumulator {
        private final String from;
        private final String to;
        private final List<Long> latencies = new ArrayList<>();
        private int callCount;
        private int errorCount;
        private long totalLatency;

        EdgeAccumulator(String from, String to) {
            this.from = from;
            this.to = to;
        }

        void add(Span child) {
            callCount++;
            if (child.isError()) {
                errorCount++;
            }
            totalLatency += child.getDuration();
            latencies.add(child.getDuration());
        }

        FlowEdge toEdge() {
            return FlowEdge.builder()
                    .from(from)
                    .to(to)
                    .callCount(callCount)
                    .errorCount(errorCount)
                    .totalLatency(totalLatency)
                    .latencies(List.copyOf(latencies))
                    .errorRate(Percentiles.rate(errorCount, callCount))
                    .avgLatency(Percentiles.average(totalLatency, callCount))
                    .build();
        }
    }
}
