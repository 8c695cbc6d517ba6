package com.flowlens.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.model.TraceFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tempo (OTLP JSON) traces: {@code batches[].scopeSpans[].spans[]} with typed attribute values and
 * byte-encoded identifiers. Older Tempo releases use {@code resourceSpans} and
 * {@code instrumentationLibrarySpans}; both spellings are read.
 */
@Component
public class TempoSpanNormalizer extends AbstractSpanNormalizer {

    private static final int OTLP_STATUS_ERROR = 2;
    private static final long NANOS_PER_MICRO = 1000L;

    public TempoSpanNormalizer(NamespaceInference namespaceInference) {
        super(namespaceInference);
    }

    @Override
    public TraceFormat getFormat() {
        return TraceFormat.TEMPO;
    }

    @Override
    protected String extractTraceId(JsonNode rawTrace) {
        String traceId = text(rawTrace, "traceID");
        if (traceId != null) {
            return traceId;
        }
        for (JsonNode batch : batches(rawTrace)) {
            for (JsonNode scope : scopeSpans(batch)) {
                for (JsonNode span : scope.path("spans")) {
                    String id = SpanIds.toHex(span.get("traceId"));
                    if (id != null) {
                        return id;
                    }
                }
            }
        }
        return null;
    }

    @Override
    protected List<RawSpan> extractSpans(JsonNode rawTrace) {
        List<RawSpan> spans = new ArrayList<>();
        for (JsonNode batch : batches(rawTrace)) {
            Map<String, String> resourceAttributes = attributes(batch.path("resource").path("attributes"));

            for (JsonNode scope : scopeSpans(batch)) {
                for (JsonNode span : scope.path("spans")) {
                    Long start = number(span, "startTimeUnixNano");
                    Long end = number(span, "endTimeUnixNano");
                    long durationNanos = start != null && end != null ? end - start : 0L;

                    spans.add(RawSpan.builder()
                            .spanId(SpanIds.toHex(span.get("spanId")))
                            .parentSpanId(SpanIds.toHex(span.get("parentSpanId")))
                            .name(text(span, "name"))
                            .startTime(start != null ? start / NANOS_PER_MICRO : null)
                            .duration(durationNanos / NANOS_PER_MICRO)
                            .error(isError(span.path("status")))
                            .scopes(List.of(attributes(span.path("attributes")), resourceAttributes))
                            .build());
                }
            }
        }
        return spans;
    }

    private static JsonNode batches(JsonNode rawTrace) {
        return rawTrace.has("batches") ? rawTrace.get("batches") : rawTrace.path("resourceSpans");
    }

    private static JsonNode scopeSpans(JsonNode batch) {
        return batch.has("scopeSpans") ? batch.get("scopeSpans") : batch.path("instrumentationLibrarySpans");
    }

    private static boolean isError(JsonNode status) {
        JsonNode code = status.get("code");
        if (code == null || code.isNull()) {
            return false;
        }
        if (code.isNumber()) {
            return code.asInt() == OTLP_STATUS_ERROR;
        }
        String text = code.asText();
        return "STATUS_CODE_ERROR".equals(text) || String.valueOf(OTLP_STATUS_ERROR).equals(text);
    }

    private static Map<String, String> attributes(JsonNode attributeArray) {
        Map<String, String> attributes = new HashMap<>();
        for (JsonNode attribute : attributeArray) {
            String key = text(attribute, "key");
            String value = anyValue(attribute.path("value"));
            if (key != null && value != null) {
                attributes.put(key, value);
            }
        }
        return attributes;
    }

    private static String anyValue(JsonNode value) {
        if (value.isValueNode()) {
            return value.asText();
        }
        for (String type : List.of("stringValue", "intValue", "boolValue", "doubleValue")) {
            JsonNode typed = value.get(type);
            if (typed != null && !typed.isNull()) {
                return typed.asText();
            }
        }
        return null;
    }
}
