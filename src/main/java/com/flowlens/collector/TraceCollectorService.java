package com.flowlens.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.config.CollectorProperties;
import com.flowlens.engine.TraceBackendEngine;
import com.flowlens.factory.TraceBackendEngineFactory;
import com.flowlens.model.CollectionResult;
import com.flowlens.model.CollectorStatus;
import com.flowlens.model.FlowGraph;
import com.flowlens.model.NormalizedTrace;
import com.flowlens.model.Span;
import com.flowlens.normalizer.NamespaceInference;
import com.flowlens.normalizer.SpanNormalizers;
import com.flowlens.service.FlowAnalyzerService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically pulls recent traces from the tracing backend into the flow store.
 *
 * <p>At most one cycle runs at a time: a tick or manual trigger that arrives while a cycle is in
 * progress is dropped, not queued. An unreachable backend ends the cycle quietly and the next tick
 * retries.
 */
@Slf4j
@Service
public class TraceCollectorService {

    private final TraceBackendEngineFactory engineFactory;
    private final SpanNormalizers normalizers;
    private final FlowAnalyzerService flowAnalyzerService;
    private final CollectorProperties properties;
    private final Clock clock;

    private final AtomicBoolean collecting = new AtomicBoolean(false);
    private volatile boolean stopped;
    private volatile Instant lastCollectionAt;
    private volatile CollectionResult lastResult;
    private volatile String lastError;

    public TraceCollectorService(TraceBackendEngineFactory engineFactory,
                                 SpanNormalizers normalizers,
                                 FlowAnalyzerService flowAnalyzerService,
                                 CollectorProperties properties,
                                 Clock clock) {
        this.engineFactory = engineFactory;
        this.normalizers = normalizers;
        this.flowAnalyzerService = flowAnalyzerService;
        this.properties = properties;
        this.clock = clock;

        if (properties.isEnabled()) {
            log.info("Trace collector initialized ({}, interval: {}ms, namespaces: {})",
                    properties.getBackendName(), properties.getIntervalMs(), namespacesLabel(properties.getAllowedNamespaces()));
        } else {
            log.info("Trace collector is disabled (set flowlens.collector.enabled=true to enable)");
        }
    }

    @Scheduled(fixedDelayString = "${flowlens.collector.interval-ms:30000}", initialDelayString = "${flowlens.collector.initial-delay-ms:0}")
    public void scheduledCollect() {
        if (!properties.isEnabled() || stopped) {
            return;
        }
        collect(properties.getAllowedNamespaces());
    }

    /**
     * Runs one cycle now against the configured allow-list.
     */
    public CollectionResult collectNow() {
        return collect(properties.getAllowedNamespaces());
    }

    /**
     * Runs one cycle now, keeping only traces from the given namespace.
     */
    public CollectionResult collectNow(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Namespace is required");
        }
        return collect(List.of(namespace.trim()));
    }

    public boolean isCollecting() {
        return collecting.get();
    }

    public CollectorStatus getStatus() {
        return CollectorStatus.builder()
                .enabled(properties.isEnabled())
                .collecting(collecting.get())
                .intervalMs(properties.getIntervalMs())
                .backend(properties.getBackendName())
                .allowedNamespaces(properties.getAllowedNamespaces())
                .lastCollectionAt(lastCollectionAt)
                .lastResult(lastResult)
                .lastError(lastError)
                .build();
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        log.info("Trace collection stopped");
    }

    CollectionResult collect(List<String> allowedNamespaces) {
        if (!collecting.compareAndSet(false, true)) {
            log.debug("Collection already in progress, skipping");
            return CollectionResult.notStarted();
        }

        CollectionResult result = CollectionResult.builder()
                .started(true)
                .namespaces(allowedNamespaces)
                .build();
        try {
            TraceBackendEngine engine = engineFactory.getEngine();
            Instant end = clock.instant();
            Instant start = end.minus(Duration.ofMinutes(properties.getLookbackMinutes()));

            List<JsonNode> traces = engine.fetchRecentTraces(start, end);
            result.setFetched(traces.size());

            for (JsonNode rawTrace : traces) {
                processTrace(engine, rawTrace, allowedNamespaces, result);
            }
            lastError = null;
            log.info("Processed {}/{} traces from {} ({} skipped, {} failed)",
                    result.getAnalyzed(), result.getFetched(), engine.getEngineType(),
                    result.getSkipped(), result.getFailed());
        } catch (ResourceAccessException e) {
            // Backend not running or not reachable; the next tick retries
            log.debug("Tracing backend unavailable: {}", e.getMessage());
            lastError = "Tracing backend unavailable: " + e.getMessage();
        } catch (Exception e) {
            log.error("Error collecting traces: {}", e.getMessage(), e);
            lastError = e.getMessage();
        } finally {
            lastCollectionAt = clock.instant();
            lastResult = result;
            collecting.set(false);
        }
        return result;
    }

    private void processTrace(TraceBackendEngine engine, JsonNode rawTrace,
                              List<String> allowedNamespaces, CollectionResult result) {
        try {
            NormalizedTrace trace = normalizers.forFormat(engine.getFormat()).normalize(rawTrace);
            if (trace == null) {
                result.setFailed(result.getFailed() + 1);
                return;
            }

            String traceNamespace = resolveTraceNamespace(trace.getSpans());
            if (!isAllowed(traceNamespace, allowedNamespaces)) {
                log.debug("Skipping trace {} (namespace: {}, not in allowed: {})",
                        shortId(trace.getTraceId()), traceNamespace, namespacesLabel(allowedNamespaces));
                result.setSkipped(result.getSkipped() + 1);
                return;
            }

            FlowGraph flowGraph = flowAnalyzerService.analyzeTrace(trace);
            if (flowGraph != null) {
                log.debug("Analyzed {} trace {} (namespace: {}, {} services)", engine.getEngineType(),
                        shortId(trace.getTraceId()), traceNamespace, flowGraph.getMetadata().getServiceCount());
                result.setAnalyzed(result.getAnalyzed() + 1);
            } else {
                result.setFailed(result.getFailed() + 1);
            }
        } catch (Exception e) {
            log.error("Error analyzing {} trace: {}", engine.getEngineType(), e.getMessage());
            result.setFailed(result.getFailed() + 1);
        }
    }

    /**
     * The first namespace other than {@code default} found on any span, else {@code default}.
     */
    static String resolveTraceNamespace(List<Span> spans) {
        for (Span span : spans) {
            String namespace = span.getNamespace();
            if (namespace != null && !namespace.isBlank() && !NamespaceInference.DEFAULT_NAMESPACE.equals(namespace)) {
                return namespace;
            }
        }
        return NamespaceInference.DEFAULT_NAMESPACE;
    }

    boolean isAllowed(String traceNamespace, List<String> allowedNamespaces) {
        if (allowedNamespaces.isEmpty()) {
            return true;
        }
        String normalized = traceNamespace.toLowerCase(Locale.ROOT);
        boolean listed = allowedNamespaces.stream()
                .map(ns -> ns.toLowerCase(Locale.ROOT))
                .anyMatch(normalized::equals);
        if (listed) {
            return true;
        }
        if (properties.isDevelopmentMode() && NamespaceInference.DEFAULT_NAMESPACE.equals(normalized)) {
            log.debug("Trace has no namespace info (default), allowing in development mode");
            return true;
        }
        return false;
    }

    private static String shortId(String traceId) {
        return traceId.length() > 16 ? traceId.substring(0, 16) + "..." : traceId;
    }

    private static String namespacesLabel(List<String> namespaces) {
        return namespaces.isEmpty() ? "all" : String.join(", ", namespaces);
    }
}
