package com.flowlens.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.model.NormalizedTrace;
import com.flowlens.model.Span;
import com.flowlens.model.SpanStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared field resolution for the wire-format normalizers. Subclasses only flatten their payload
 * into {@link RawSpan}s.
 */
@Slf4j
public abstract class AbstractSpanNormalizer implements SpanNormalizer {

    static final String UNKNOWN_SERVICE = "unknown-service";
    static final String UNKNOWN_POD = "unknown-pod";
    static final String UNKNOWN_OPERATION = "unknown";

    private final NamespaceInference namespaceInference;

    protected AbstractSpanNormalizer(NamespaceInference namespaceInference) {
        this.namespaceInference = namespaceInference;
    }

    protected abstract String extractTraceId(JsonNode rawTrace);

    protected abstract List<RawSpan> extractSpans(JsonNode rawTrace);

    @Override
    public NormalizedTrace normalize(JsonNode rawTrace) {
        if (rawTrace == null || rawTrace.isNull() || rawTrace.isMissingNode()) {
            return null;
        }
        try {
            String traceId = extractTraceId(rawTrace);
            List<RawSpan> rawSpans = extractSpans(rawTrace);
            if (traceId == null || traceId.isEmpty()) {
                log.debug("Skipping {} trace without a trace id", getFormat());
                return null;
            }
            if (rawSpans.isEmpty()) {
                log.debug("Skipping {} trace {} without spans", getFormat(), traceId);
                return null;
            }

            List<Span> spans = rawSpans.stream()
                    .map(this::toSpan)
                    .collect(Collectors.toList());

            RawSpan first = rawSpans.get(0);
            String operationName = first.getName();
            if (operationName == null || operationName.isBlank()) {
                operationName = AttributeField.OPERATION_NAME.resolve(first.getScopes());
            }

            return NormalizedTrace.builder()
                    .traceId(traceId)
                    .spans(spans)
                    .operationName(operationName != null ? operationName : UNKNOWN_OPERATION)
                    .uiEvent(AttributeField.UI_EVENT.resolve(first.getScopes()))
                    .build();
        } catch (Exception e) {
            log.warn("Could not normalize {} trace: {}", getFormat(), e.getMessage());
            return null;
        }
    }

    private Span toSpan(RawSpan raw) {
        List<Map<String, String>> scopes = raw.getScopes();

        String serviceName = AttributeField.SERVICE_NAME.resolve(scopes);
        if (serviceName == null) {
            serviceName = raw.getFallbackServiceName() != null && !raw.getFallbackServiceName().isBlank()
                    ? raw.getFallbackServiceName()
                    : UNKNOWN_SERVICE;
        }
        String namespace = namespaceInference.resolve(AttributeField.NAMESPACE.resolve(scopes), serviceName);
        String podName = AttributeField.POD_NAME.resolve(scopes);

        return Span.builder()
                .spanId(raw.getSpanId())
                .parentSpanId(raw.getParentSpanId())
                .operationName(raw.getName() != null ? raw.getName() : UNKNOWN_OPERATION)
                .startTime(raw.getStartTime())
                .duration(Math.max(0, raw.getDuration()))
                .status(raw.isError() ? SpanStatus.ERROR : SpanStatus.OK)
                .serviceName(serviceName)
                .namespace(namespace)
                .podName(podName != null ? podName : UNKNOWN_POD)
                .serviceVersion(AttributeField.SERVICE_VERSION.resolve(scopes))
                .environment(AttributeField.ENVIRONMENT.resolve(scopes))
                .attributes(mergeScopes(scopes))
                .build();
    }

    private static Map<String, String> mergeScopes(List<Map<String, String>> scopes) {
        Map<String, String> merged = new HashMap<>();
        List<Map<String, String>> leastSpecificFirst = new ArrayList<>(scopes);
        Collections.reverse(leastSpecificFirst);
        for (Map<String, String> scope : leastSpecificFirst) {
            if (scope != null) {
                merged.putAll(scope);
            }
        }
        return merged;
    }

    // Helpers shared by both wire formats

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    static Long number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asLong();
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
