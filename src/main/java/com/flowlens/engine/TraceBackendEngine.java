package com.flowlens.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.model.TraceFormat;

import java.time.Instant;
import java.util.List;

/**
 * Core interface for tracing backends the collector pulls from.
 * Supports Jaeger and Tempo; exactly one engine is active, chosen by {@code flowlens.collector.backend}.
 */
public interface TraceBackendEngine {

    /**
     * Recent traces with full span detail, in this engine's {@link #getFormat() wire format}.
     *
     * @throws org.springframework.web.client.ResourceAccessException when the backend can't be reached
     */
    List<JsonNode> fetchRecentTraces(Instant start, Instant end);

    TraceFormat getFormat();

    boolean testConnection();

    // Engine type identifier
    String getEngineType();
}
