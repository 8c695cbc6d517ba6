package com.flowlens.service;

import com.flowlens.analyzer.Percentiles;
import com.flowlens.model.CacheStats;
import com.flowlens.model.DependencyEdge;
import com.flowlens.model.DependencyGraph;
import com.flowlens.model.FlowGraph;
import com.flowlens.model.FlowNode;
import com.flowlens.model.FlowQuery;
import com.flowlens.model.OperationStats;
import com.flowlens.model.OperationSummary;
import com.flowlens.model.ServiceInfo;
import com.flowlens.store.FlowStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only views over the flow store.
 */
@Service
@RequiredArgsConstructor
public class FlowQueryService {

    private final FlowStore flowStore;

    public Optional<FlowGraph> getFlowGraph(String traceId) {
        return flowStore.get(traceId);
    }

    /**
     * Flows matching every given filter, newest first. A namespace matches when any node of the
     * flow lives in it, ignoring case.
     */
    public List<FlowGraph> getFlowGraphs(FlowQuery query) {
        Stream<FlowGraph> flows = flowStore.listAll().stream();

        if (hasText(query.getOperationName())) {
            flows = flows.filter(flow -> query.getOperationName().equals(flow.getOperationName()));
        }
        if (hasText(query.getNamespace())) {
            flows = flows.filter(flow -> flow.hasNamespace(query.getNamespace()));
        }
        if (query.getStartTime() != null) {
            flows = flows.filter(flow -> flow.getStartTime() >= query.getStartTime());
        }
        if (query.getEndTime() != null) {
            flows = flows.filter(flow -> flow.getEndTime() <= query.getEndTime());
        }
        if (hasText(query.getEnvironment())) {
            flows = flows.filter(flow -> query.getEnvironment().equals(flow.getMetadata().getEnvironment()));
        }

        flows = flows.sorted(Comparator.comparingLong(FlowGraph::getStartTime).reversed());
        if (query.getLimit() != null && query.getLimit() > 0) {
            flows = flows.limit(query.getLimit());
        }
        return flows.collect(Collectors.toList());
    }

    /**
     * Projects the cluster dependency records into a graph. The namespace filter ignores case and
     * matches either end of an edge; the service filter is exact and also matches either end.
     */
    public DependencyGraph getServiceDependencies(String namespace, String serviceName) {
        Stream<DependencyEdge> dependencies = flowStore.listDependencies().stream();

        if (hasText(namespace)) {
            dependencies = dependencies.filter(dep -> namespace.equalsIgnoreCase(dep.getSourceNamespace())
                    || namespace.equalsIgnoreCase(dep.getTargetNamespace()));
        }
        if (hasText(serviceName)) {
            dependencies = dependencies.filter(dep -> serviceName.equals(dep.getSourceService())
                    || serviceName.equals(dep.getTargetService()));
        }

        Map<String, DependencyGraph.Node> nodes = new LinkedHashMap<>();
        List<DependencyGraph.Edge> edges = new ArrayList<>();

        dependencies.forEach(dep -> {
            nodes.computeIfAbsent(dep.sourceId(),
                    id -> graphNode(id, dep.getSourceNamespace(), dep.getSourceService()));
            nodes.computeIfAbsent(dep.targetId(),
                    id -> graphNode(id, dep.getTargetNamespace(), dep.getTargetService()));

            edges.add(DependencyGraph.Edge.builder()
                    .from(dep.sourceId())
                    .to(dep.targetId())
                    .callCount(dep.getCallCount())
                    .errorCount(dep.getErrorCount())
                    .errorRate(Percentiles.rate(dep.getErrorCount(), dep.getCallCount()))
                    .avgLatency(Percentiles.average(dep.getTotalLatency(), dep.getCallCount()))
                    .lastSeen(dep.getLastSeen())
                    .build());
        });

        return DependencyGraph.builder()
                .nodes(new ArrayList<>(nodes.values()))
                .edges(edges)
                .build();
    }

    /**
     * Statistics for one operation over an optional time window, with latency percentiles pooled
     * across every node of every matching flow.
     *
     * @return empty when no flow matches
     */
    public Optional<OperationStats> getOperationStats(String operationName, Long startTime, Long endTime) {
        List<FlowGraph> flows = getFlowGraphs(FlowQuery.builder()
                .operationName(operationName)
                .startTime(startTime)
                .endTime(endTime)
                .build());
        if (flows.isEmpty()) {
            return Optional.empty();
        }

        int successCount = (int) flows.stream()
                .filter(flow -> flow.getMetadata().getErrorCount() == 0)
                .count();

        List<Long> latencies = new ArrayList<>();
        Map<String, OperationStats.ServiceBreakdown> services = new LinkedHashMap<>();
        for (FlowGraph flow : flows) {
            for (FlowNode node : flow.getNodes()) {
                latencies.addAll(node.getMetrics().getLatencies());

                OperationStats.ServiceBreakdown breakdown = services.computeIfAbsent(
                        node.getService().getName(),
                        name -> OperationStats.ServiceBreakdown.builder().name(name).build());
                breakdown.setRequestCount(breakdown.getRequestCount() + node.getMetrics().getRequestCount());
                breakdown.setErrorCount(breakdown.getErrorCount() + node.getMetrics().getErrorCount());
            }
        }
        long totalLatency = latencies.stream().mapToLong(Long::longValue).sum();

        return Optional.of(OperationStats.builder()
                .operationName(operationName)
                .totalRequests(flows.size())
                .successCount(successCount)
                .errorCount(flows.size() - successCount)
                .avgLatency(Percentiles.average(totalLatency, latencies.size()))
                .p50Latency(Percentiles.nearestRank(latencies, 50))
                .p95Latency(Percentiles.nearestRank(latencies, 95))
                .p99Latency(Percentiles.nearestRank(latencies, 99))
                .services(services)
                .build());
    }

    /**
     * Distinct operation names seen in stored flows, alphabetically.
     */
    public List<OperationSummary> listOperations() {
        Map<String, OperationSummary> operations = new TreeMap<>();
        for (FlowGraph flow : flowStore.listAll()) {
            OperationSummary summary = operations.computeIfAbsent(flow.getOperationName(),
                    name -> OperationSummary.builder().name(name).build());
            summary.setFlowCount(summary.getFlowCount() + 1);
            summary.setLastStartTime(Math.max(summary.getLastStartTime(), flow.getStartTime()));
        }
        return new ArrayList<>(operations.values());
    }

    public Set<String> listNamespaces() {
        Set<String> namespaces = new LinkedHashSet<>();
        for (FlowGraph flow : flowStore.listAll()) {
            namespaces.addAll(flow.getMetadata().getNamespaces());
        }
        return namespaces;
    }

    public CacheStats getCacheStats() {
        return flowStore.stats();
    }

    private static DependencyGraph.Node graphNode(String id, String namespace, String serviceName) {
        return DependencyGraph.Node.builder()
                .id(id)
                .service(ServiceInfo.builder().name(serviceName).namespace(namespace).build())
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
