package com.flowlens.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.model.TraceFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Jaeger query API traces: {@code {traceID, spans[], processes{}}} with flat tag arrays.
 */
@Component
public class JaegerSpanNormalizer extends AbstractSpanNormalizer {

    private static final String CHILD_OF = "CHILD_OF";

    public JaegerSpanNormalizer(NamespaceInference namespaceInference) {
        super(namespaceInference);
    }

    @Override
    public TraceFormat getFormat() {
        return TraceFormat.JAEGER;
    }

    @Override
    protected String extractTraceId(JsonNode rawTrace) {
        String traceId = text(rawTrace, "traceID");
        if (traceId == null) {
            JsonNode first = rawTrace.path("spans").path(0);
            if (first.isObject()) {
                traceId = text(first, "traceID");
            }
        }
        return traceId;
    }

    @Override
    protected List<RawSpan> extractSpans(JsonNode rawTrace) {
        JsonNode processes = rawTrace.path("processes");
        List<RawSpan> spans = new ArrayList<>();

        for (JsonNode span : rawTrace.path("spans")) {
            Map<String, String> tags = tags(span.path("tags"));

            JsonNode process = span.has("process")
                    ? span.get("process")
                    : processes.path(span.path("processID").asText(""));
            Map<String, String> processTags = tags(process.path("tags"));

            spans.add(RawSpan.builder()
                    .spanId(text(span, "spanID"))
                    .parentSpanId(parentOf(span))
                    .name(text(span, "operationName"))
                    .startTime(number(span, "startTime"))
                    .duration(durationOf(span))
                    .error(isError(tags))
                    .scopes(List.of(tags, processTags))
                    .fallbackServiceName(text(process, "serviceName"))
                    .build());
        }
        return spans;
    }

    private static String parentOf(JsonNode span) {
        String parent = text(span, "parentSpanID");
        if (parent != null) {
            return parent;
        }
        for (JsonNode reference : span.path("references")) {
            if (CHILD_OF.equals(reference.path("refType").asText())) {
                return text(reference, "spanID");
            }
        }
        return null;
    }

    private static long durationOf(JsonNode span) {
        Long duration = number(span, "duration");
        return duration != null ? duration : 0L;
    }

    private static boolean isError(Map<String, String> tags) {
        String error = tags.get("error");
        if (error != null && !"false".equalsIgnoreCase(error)) {
            return true;
        }
        return "ERROR".equalsIgnoreCase(tags.get("otel.status_code"));
    }

    private static Map<String, String> tags(JsonNode tagArray) {
        Map<String, String> tags = new HashMap<>();
        for (JsonNode tag : tagArray) {
            String key = text(tag, "key");
            JsonNode value = tag.get("value");
            if (key != null && value != null && !value.isNull()) {
                tags.put(key, value.asText());
            }
        }
        return tags;
    }
}
