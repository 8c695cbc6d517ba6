package com.flowlens.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowlens.analyzer.FlowGraphBuilder;
import com.flowlens.model.FlowGraph;
import com.flowlens.model.NormalizedTrace;
import com.flowlens.model.TraceFormat;
import com.flowlens.store.FlowStore;
import java.util.List;
import org.junit.jupiter.api.Test;

import static com.flowlens.TestObjects.MAPPER;
import static com.flowlens.TestObjects.fixedClock;
import static com.flowlens.TestObjects.fixture;
import static com.flowlens.TestObjects.normalizers;
import static com.flowlens.TestObjects.ok;
import static com.flowlens.TestObjects.storeProperties;
import static org.assertj.core.api.Assertions.assertThat;

class FlowAnalyzerServiceTest {
  FlowStore store = new FlowStore(storeProperties(0, 0), fixedClock());
  FlowAnalyzerService analyzer = new FlowAnalyzerService(normalizers(), new FlowGraphBuilder(), store);

  @Test void analyzeRawTrace_jaeger() {
    FlowGraph flow = analyzer.analyzeRawTrace(fixture("jaeger-trace.json"), TraceFormat.JAEGER);

    assertThat(flow.getTraceId()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
    assertThat(store.get(flow.getTraceId())).containsSame(flow);
    assertThat(store.listDependencies()).hasSize(1);
    assertThat(store.listDependencies().get(0).getLastSeen()).isEqualTo(fixedClock().millis());
  }

  @Test void analyzeRawTrace_tempo() {
    FlowGraph flow = analyzer.analyzeRawTrace(fixture("tempo-trace.json"), TraceFormat.TEMPO);

    assertThat(flow.getEdges()).hasSize(1);
    assertThat(store.stats().getFlowGraphsCount()).isEqualTo(1);
  }

  @Test void notAnalyzable_storesNothing() {
    ObjectNode noSpans = MAPPER.createObjectNode().put("traceID", "abc");
    noSpans.putArray("spans");

    assertThat(analyzer.analyzeRawTrace(noSpans, TraceFormat.JAEGER)).isNull();
    assertThat(analyzer.analyzeRawTrace(MAPPER.createArrayNode(), TraceFormat.TEMPO)).isNull();
    assertThat(store.stats().getFlowGraphsCount()).isZero();
  }

  @Test void sameTraceTwice_overwritesFlowButCountsCallsTwice() {
    NormalizedTrace trace = NormalizedTrace.builder()
      .traceId("t1")
      .spans(List.of(ok("1", null, "ccs", "api", 0, 10), ok("2", "1", "ccs", "db", 1, 5)))
      .build();

    analyzer.analyzeTrace(trace);
    analyzer.analyzeTrace(trace);

    assertThat(store.stats().getFlowGraphsCount()).isEqualTo(1);
    assertThat(store.listDependencies().get(0).getCallCount()).isEqualTo(2L);
    assertThat(store.get("t1").get().getOperationName()).isEqualTo("unknown");
  }
}
