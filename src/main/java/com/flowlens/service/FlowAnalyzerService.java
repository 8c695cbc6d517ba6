package com.flowlens.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.analyzer.FlowGraphBuilder;
import com.flowlens.model.FlowGraph;
import com.flowlens.model.NormalizedTrace;
import com.flowlens.model.TraceFormat;
import com.flowlens.normalizer.SpanNormalizers;
import com.flowlens.store.FlowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Normalize, build and store: the single write path into the flow store, shared by the collector
 * and manual analyze requests.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowAnalyzerService {

    private final SpanNormalizers normalizers;
    private final FlowGraphBuilder flowGraphBuilder;
    private final FlowStore flowStore;

    /**
     * @return the stored flow graph, or null when the payload isn't analyzable
     */
    public FlowGraph analyzeRawTrace(JsonNode rawTrace, TraceFormat format) {
        NormalizedTrace trace = normalizers.forFormat(format).normalize(rawTrace);
        if (trace == null) {
            log.debug("{} payload could not be normalized", format);
            return null;
        }
        return analyzeTrace(trace);
    }

    /**
     * @return the stored flow graph, or null when the trace has no spans
     */
    public FlowGraph analyzeTrace(NormalizedTrace trace) {
        try {
            FlowGraph flowGraph = flowGraphBuilder.build(
                    trace.getTraceId(), trace.getSpans(), trace.getOperationName(), trace.getUiEvent());
            if (flowGraph == null) {
                return null;
            }

            flowStore.put(flowGraph);
            flowStore.recordDependencies(flowGraph.getEdges());

            log.info("Cached flow graph: {} ({} nodes, {} edges, namespace: {})",
                    flowGraph.getFlowId(), flowGraph.getNodes().size(), flowGraph.getEdges().size(),
                    flowGraph.getMetadata().getNamespace());
            return flowGraph;
        } catch (Exception e) {
            log.error("Error analyzing trace {}", trace.getTraceId(), e);
            return null;
        }
    }
}
