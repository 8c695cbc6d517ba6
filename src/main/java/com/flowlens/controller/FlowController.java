package com.flowlens.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.collector.TraceCollectorService;
import com.flowlens.config.CollectorProperties;
import com.flowlens.factory.TraceBackendEngineFactory;
import com.flowlens.model.CacheStats;
import com.flowlens.model.CollectionResult;
import com.flowlens.model.CollectorStatus;
import com.flowlens.model.DependencyGraph;
import com.flowlens.model.FlowGraph;
import com.flowlens.model.FlowQuery;
import com.flowlens.model.OperationStats;
import com.flowlens.model.TraceFormat;
import com.flowlens.service.FlowAnalyzerService;
import com.flowlens.service.FlowQueryService;
import com.flowlens.store.FlowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Query and control endpoints for analyzed service flows
 */
@Slf4j
@RestController
@RequestMapping("/api/flows")
@RequiredArgsConstructor
public class FlowController {

    private final FlowQueryService flowQueryService;
    private final FlowAnalyzerService flowAnalyzerService;
    private final TraceCollectorService traceCollectorService;
    private final TraceBackendEngineFactory engineFactory;
    private final FlowStore flowStore;
    private final CollectorProperties collectorProperties;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getFlows(
            @RequestParam(value = "operation", required = false) String operation,
            @RequestParam(value = "namespace", required = false) String namespace,
            @RequestParam(value = "startTime", required = false) Long startTime,
            @RequestParam(value = "endTime", required = false) Long endTime,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "limit", required = false) Integer limit) {

        FlowQuery query = FlowQuery.builder()
                .operationName(operation)
                .namespace(namespace)
                .startTime(startTime)
                .endTime(endTime)
                .environment(environment)
                .limit(limit)
                .build();
        List<FlowGraph> flows = flowQueryService.getFlowGraphs(query);

        Map<String, Object> response = new HashMap<>();
        response.put("flows", flows);
        response.put("total", flows.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/operations")
    public ResponseEntity<Map<String, Object>> getOperations() {
        Map<String, Object> response = new HashMap<>();
        response.put("operations", flowQueryService.listOperations());
        response.put("namespaces", flowQueryService.listNamespaces());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/operations/{operationName}/stats")
    public ResponseEntity<OperationStats> getOperationStats(
            @PathVariable String operationName,
            @RequestParam(value = "startTime", required = false) Long startTime,
            @RequestParam(value = "endTime", required = false) Long endTime) {
        return flowQueryService.getOperationStats(operationName, startTime, endTime)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/dependencies")
    public ResponseEntity<DependencyGraph> getDependencies(
            @RequestParam(value = "namespace", required = false) String namespace,
            @RequestParam(value = "serviceName", required = false) String serviceName) {
        return ResponseEntity.ok(flowQueryService.getServiceDependencies(namespace, serviceName));
    }

    @PostMapping("/analyze")
    public ResponseEntity<?> analyzeTrace(
            @RequestBody JsonNode rawTrace,
            @RequestParam(value = "format", required = false) String format) {
        TraceFormat traceFormat;
        try {
            traceFormat = format != null
                    ? TraceFormat.fromName(format)
                    : engineFactory.getEngine().getFormat();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error("Unknown trace format: " + format));
        }

        log.info("Analyze request for a {} trace", traceFormat);
        FlowGraph flowGraph = flowAnalyzerService.analyzeRawTrace(rawTrace, traceFormat);
        if (flowGraph == null) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(error("Trace could not be analyzed"));
        }
        return ResponseEntity.ok(flowGraph);
    }

    @PostMapping("/collect")
    public ResponseEntity<?> collect(@RequestParam(value = "namespace", required = false) String namespace) {
        try {
            CollectionResult result = namespace != null
                    ? traceCollectorService.collectNow(namespace)
                    : traceCollectorService.collectNow();

            Map<String, Object> response = new HashMap<>();
            response.put("result", result);
            response.put("message", result.isStarted()
                    ? "Trace collection completed"
                    : "Trace collection already in progress");
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        }
    }

    @GetMapping("/collector/status")
    public ResponseEntity<CollectorStatus> getCollectorStatus() {
        return ResponseEntity.ok(traceCollectorService.getStatus());
    }

    @GetMapping("/collector/health")
    public ResponseEntity<Map<String, Object>> getBackendHealth() {
        boolean reachable = engineFactory.getEngine().testConnection();

        Map<String, Object> response = new HashMap<>();
        response.put("backend", engineFactory.getEngine().getEngineType());
        response.put("url", "tempo".equals(collectorProperties.getBackendName())
                ? collectorProperties.getTempoUrl()
                : collectorProperties.getJaegerUrl());
        response.put("reachable", reachable);
        return ResponseEntity.status(reachable ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> getCacheStats() {
        return ResponseEntity.ok(flowQueryService.getCacheStats());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<CacheStats> clearCache() {
        flowStore.clear();
        return ResponseEntity.ok(flowStore.stats());
    }

    // /trace/{traceId} reaches ids that collide with the fixed paths above, such as "operations"
    @GetMapping({"/{traceId}", "/trace/{traceId}"})
    public ResponseEntity<FlowGraph> getFlow(@PathVariable String traceId) {
        return flowQueryService.getFlowGraph(traceId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static Map<String, String> error(String message) {
        Map<String, String> body = new HashMap<>();
        body.put("error", message);
        return body;
    }
}
