package com.flowlens.engine.tempo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowlens.config.CollectorProperties;
import com.flowlens.engine.TraceBackendEngine;
import com.flowlens.model.TraceFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tempo implementation of TraceBackendEngine.
 * Search only returns trace summaries, so every hit is fetched again by id for its spans.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "flowlens.collector.backend", havingValue = "tempo")
public class TempoBackendEngine implements TraceBackendEngine {

    private final RestClient tracingRestClient;
    private final CollectorProperties properties;

    @Override
    public String getEngineType() {
        return "Tempo";
    }

    @Override
    public TraceFormat getFormat() {
        return TraceFormat.TEMPO;
    }

    @Override
    public List<JsonNode> fetchRecentTraces(Instant start, Instant end) {
        URI searchUri = UriComponentsBuilder.fromHttpUrl(properties.getTempoUrl())
                .path("/api/search")
                .queryParam("start", start.getEpochSecond())
                .queryParam("end", end.getEpochSecond())
                .queryParam("limit", properties.getLimit())
                .build()
                .toUri();

        JsonNode response = tracingRestClient.get()
                .uri(searchUri)
                .retrieve()
                .body(JsonNode.class);

        if (response == null || !response.path("traces").isArray()) {
            log.info("No traces found in Tempo (or empty response)");
            return List.of();
        }

        JsonNode summaries = response.get("traces");
        log.info("Found {} traces in Tempo", summaries.size());

        List<JsonNode> traces = new ArrayList<>();
        for (JsonNode summary : summaries) {
            String traceId = summary.path("traceID").asText("");
            if (traceId.isEmpty()) continue;
            try {
                JsonNode trace = fetchTrace(traceId);
                if (trace != null) {
                    traces.add(trace);
                }
            } catch (ResourceAccessException e) {
                throw e;
            } catch (Exception e) {
                log.error("Error fetching Tempo trace {}: {}", traceId, e.getMessage());
            }
        }
        return traces;
    }

    /**
     * Full trace by id, with the id added as {@code traceID} since Tempo's payload only carries it
     * per span.
     */
    public JsonNode fetchTrace(String traceId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getTempoUrl())
                .path("/api/traces/{traceId}")
                .buildAndExpand(traceId)
                .toUri();

        JsonNode trace = tracingRestClient.get()
                .uri(uri)
                .retrieve()
                .body(JsonNode.class);

        if (trace instanceof ObjectNode) {
            ((ObjectNode) trace).put("traceID", traceId);
        }
        return trace;
    }

    @Override
    public boolean testConnection() {
        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(properties.getTempoUrl())
                    .path("/ready")
                    .build()
                    .toUri();
            tracingRestClient.get().uri(uri).retrieve().toBodilessEntity();
            return true;
        } catch (Exception e) {
            log.warn("Tempo connection test failed: {}", e.getMessage());
            return false;
        }
    }
}
