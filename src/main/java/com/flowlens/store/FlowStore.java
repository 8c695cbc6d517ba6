package com.flowlens.store;

import com.flowlens.config.StoreProperties;
import com.flowlens.model.CacheStats;
import com.flowlens.model.DependencyEdge;
import com.flowlens.model.FlowEdge;
import com.flowlens.model.FlowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide cache of analyzed flows and the cluster dependency edges folded from them.
 *
 * <p>Flow graphs are keyed by trace id; a repeated trace id replaces the stored graph. Past the
 * configured bound the oldest inserted graph is evicted. Stored graphs are immutable.
 *
 * <p>Dependency edges are keyed {@code source->target} and only accumulate. Past the bound the
 * least recently folded edge is evicted. Reads return copies.
 */
@Slf4j
@Component
public class FlowStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final BoundedMap<String, FlowGraph> flowGraphsByTraceId;
    private final BoundedMap<String, DependencyEdge> dependencyEdgesByPairKey;
    private final Clock clock;

    public FlowStore(StoreProperties properties, Clock clock) {
        this.flowGraphsByTraceId = new BoundedMap<>(properties.getMaxFlowGraphs(), false);
        // Access order: every fold moves the record to the young end
        this.dependencyEdgesByPairKey = new BoundedMap<>(properties.getMaxDependencyEdges(), true);
        this.clock = clock;
        log.info("Flow store initialized (max flow graphs: {}, max dependency edges: {})",
                boundLabel(properties.getMaxFlowGraphs()), boundLabel(properties.getMaxDependencyEdges()));
    }

    public void put(FlowGraph flowGraph) {
        lock.writeLock().lock();
        try {
            flowGraphsByTraceId.put(flowGraph.getTraceId(), flowGraph);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<FlowGraph> get(String traceId) {
        if (traceId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(flowGraphsByTraceId.get(traceId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<FlowGraph> listAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(flowGraphsByTraceId.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Adds the calls of one flow's edges to the cluster-wide dependency records.
     */
    public void recordDependencies(List<FlowEdge> edges) {
        long now = clock.millis();
        lock.writeLock().lock();
        try {
            for (FlowEdge edge : edges) {
                DependencyEdge dependency = dependencyEdgesByPairKey.get(edge.key());
                if (dependency == null) {
                    dependency = newDependency(edge);
                    dependencyEdgesByPairKey.put(edge.key(), dependency);
                }
                dependency.setCallCount(dependency.getCallCount() + edge.getCallCount());
                dependency.setErrorCount(dependency.getErrorCount() + edge.getErrorCount());
                dependency.setTotalLatency(dependency.getTotalLatency() + edge.getTotalLatency());
                dependency.setLastSeen(now);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<DependencyEdge> listDependencies() {
        lock.readLock().lock();
        try {
            List<DependencyEdge> copies = new ArrayList<>(dependencyEdgesByPairKey.size());
            for (DependencyEdge dependency : dependencyEdgesByPairKey.values()) {
                copies.add(dependency.toBuilder().build());
            }
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            flowGraphsByTraceId.clear();
            dependencyEdgesByPairKey.clear();
            flowGraphsByTraceId.resetEvictions();
            dependencyEdgesByPairKey.resetEvictions();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Flow store cleared");
    }

    public CacheStats stats() {
        lock.readLock().lock();
        try {
            return CacheStats.builder()
                    .flowGraphsCount(flowGraphsByTraceId.size())
                    .dependenciesCount(dependencyEdgesByPairKey.size())
                    .evictedFlowGraphs(flowGraphsByTraceId.getEvictions())
                    .evictedDependencies(dependencyEdgesByPairKey.getEvictions())
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static DependencyEdge newDependency(FlowEdge edge) {
        String[] source = splitNodeId(edge.getFrom());
        String[] target = splitNodeId(edge.getTo());
        return DependencyEdge.builder()
                .sourceNamespace(source[0])
                .sourceService(source[1])
                .targetNamespace(target[0])
                .targetService(target[1])
                .build();
    }

    // Node ids are "namespace/service"; namespaces never contain a slash
    private static String[] splitNodeId(String nodeId) {
        int slash = nodeId.indexOf('/');
        if (slash < 0) {
            return new String[]{"default", nodeId};
        }
        return new String[]{nodeId.substring(0, slash), nodeId.substring(slash + 1)};
    }

    private static String boundLabel(int bound) {
        return bound > 0 ? String.valueOf(bound) : "unbounded";
    }
}
