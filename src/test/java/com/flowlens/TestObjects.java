package com.flowlens;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowlens.config.NormalizerProperties;
import com.flowlens.config.StoreProperties;
import com.flowlens.model.Span;
import com.flowlens.model.SpanStatus;
import com.flowlens.normalizer.JaegerSpanNormalizer;
import com.flowlens.normalizer.NamespaceInference;
import com.flowlens.normalizer.SpanNormalizers;
import com.flowlens.normalizer.TempoSpanNormalizer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

public final class TestObjects {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    /** Epoch microseconds of 2023-11-14T22:13:20Z */
    public static final long T0 = 1_700_000_000_000_000L;
    public static final Instant NOW = Instant.ofEpochSecond(1_700_000_300L);

    private TestObjects() {
    }

    public static Span span(String spanId, String parentSpanId, String namespace, String service,
                            Long startTime, long duration, SpanStatus status) {
        return Span.builder()
                .spanId(spanId)
                .parentSpanId(parentSpanId)
                .operationName(service + " work")
                .startTime(startTime)
                .duration(duration)
                .status(status)
                .serviceName(service)
                .namespace(namespace)
                .podName(service + "-0")
                .build();
    }

    public static Span ok(String spanId, String parentSpanId, String namespace, String service,
                          long startOffset, long duration) {
        return span(spanId, parentSpanId, namespace, service, T0 + startOffset, duration, SpanStatus.OK);
    }

    public static Span error(String spanId, String parentSpanId, String namespace, String service,
                             long startOffset, long duration) {
        return span(spanId, parentSpanId, namespace, service, T0 + startOffset, duration, SpanStatus.ERROR);
    }

    public static JsonNode fixture(String name) {
        try (InputStream in = TestObjects.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String fixtureText(String name) {
        try (InputStream in = TestObjects.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * A single-span Jaeger trace whose process publishes the given namespace, or none when null.
     */
    public static ObjectNode jaegerTrace(String traceId, String service, String namespace) {
        ObjectNode trace = MAPPER.createObjectNode();
        trace.put("traceID", traceId);

        ObjectNode span = trace.putArray("spans").addObject();
        span.put("spanID", "00000000000000a1");
        span.put("operationName", "GET /" + service);
        span.put("startTime", T0);
        span.put("duration", 1000);
        span.putArray("tags");

        ObjectNode process = span.putObject("process");
        process.put("serviceName", service);
        ArrayNode tags = process.putArray("tags");
        if (namespace != null) {
            tags.addObject().put("key", "k8s.namespace.name").put("value", namespace);
        }
        return trace;
    }

    public static NamespaceInference namespaceInference() {
        return new NamespaceInference(new NormalizerProperties());
    }

    public static SpanNormalizers normalizers() {
        NamespaceInference inference = namespaceInference();
        return new SpanNormalizers(List.of(new JaegerSpanNormalizer(inference), new TempoSpanNormalizer(inference)));
    }

    public static StoreProperties storeProperties(int maxFlowGraphs, int maxDependencyEdges) {
        StoreProperties properties = new StoreProperties();
        properties.setMaxFlowGraphs(maxFlowGraphs);
        properties.setMaxDependencyEdges(maxDependencyEdges);
        return properties;
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    /** A clock tests can move forward. */
    public static final class TestClock extends Clock {
        private volatile Instant instant;

        public TestClock(Instant instant) {
            this.instant = instant;
        }

        public void advanceMillis(long millis) {
            instant = instant.plusMillis(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
