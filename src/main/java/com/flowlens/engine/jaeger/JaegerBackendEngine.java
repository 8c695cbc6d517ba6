package com.flowlens.engine.jaeger;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.config.CollectorProperties;
import com.flowlens.engine.TraceBackendEngine;
import com.flowlens.model.TraceFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Jaeger implementation of TraceBackendEngine.
 * The query API returns full span detail inline, so one request per cycle is enough.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "flowlens.collector.backend", havingValue = "jaeger", matchIfMissing = true)
public class JaegerBackendEngine implements TraceBackendEngine {

    private final RestClient tracingRestClient;
    private final CollectorProperties properties;

    @Override
    public String getEngineType() {
        return "Jaeger";
    }

    @Override
    public TraceFormat getFormat() {
        return TraceFormat.JAEGER;
    }

    @Override
    public List<JsonNode> fetchRecentTraces(Instant start, Instant end) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getJaegerUrl())
                .path("/api/traces")
                .queryParam("service", properties.getServiceName())
                .queryParam("start", toMicros(start))
                .queryParam("end", toMicros(end))
                .queryParam("limit", properties.getLimit())
                .build()
                .toUri();

        JsonNode response = tracingRestClient.get()
                .uri(uri)
                .retrieve()
                .body(JsonNode.class);

        List<JsonNode> traces = new ArrayList<>();
        if (response != null) {
            response.path("data").forEach(traces::add);
        }
        log.info("Found {} traces in Jaeger", traces.size());
        return traces;
    }

    @Override
    public boolean testConnection() {
        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(properties.getJaegerUrl())
                    .path("/api/services")
                    .build()
                    .toUri();
            tracingRestClient.get().uri(uri).retrieve().toBodilessEntity();
            return true;
        } catch (Exception e) {
            log.warn("Jaeger connection test failed: {}", e.getMessage());
            return false;
        }
    }

    // Jaeger's query API works in epoch microseconds
    static long toMicros(Instant instant) {
        return instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000L;
    }
}
