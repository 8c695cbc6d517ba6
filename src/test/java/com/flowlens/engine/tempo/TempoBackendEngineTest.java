package com.flowlens.engine.tempo;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.config.CollectorProperties;
import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import static com.flowlens.TestObjects.NOW;
import static com.flowlens.TestObjects.fixtureText;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TempoBackendEngineTest {
  static final Instant START = NOW.minus(Duration.ofMinutes(5));
  static final String FIRST = "4bf92f3577b34da6a3ce929d0e0e4736";
  static final String SECOND = "9af92f3577b34da6a3ce929d0e0e4738";

  RestClient.Builder builder = RestClient.builder();
  MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
  CollectorProperties properties = new CollectorProperties();
  TempoBackendEngine engine;

  {
    properties.setTempoUrl("http://tempo:3200");
    engine = new TempoBackendEngine(builder.build(), properties);
  }

  @AfterEach void verify() {
    server.verify();
  }

  void expectSearch() {
    server.expect(requestTo(startsWith("http://tempo:3200/api/search")))
      .andExpect(queryParam("start", "1700000000"))
      .andExpect(queryParam("end", "1700000300"))
      .andExpect(queryParam("limit", "100"))
      .andRespond(withSuccess(fixtureText("tempo-search-response.json"), MediaType.APPLICATION_JSON));
  }

  @Test void fetchRecentTraces_fetchesEachHitById() {
    expectSearch();
    server.expect(requestTo("http://tempo:3200/api/traces/" + FIRST))
      .andRespond(withSuccess(fixtureText("tempo-trace.json"), MediaType.APPLICATION_JSON));
    server.expect(requestTo("http://tempo:3200/api/traces/" + SECOND))
      .andRespond(withSuccess(fixtureText("tempo-trace-legacy.json"), MediaType.APPLICATION_JSON));

    List<JsonNode> traces = engine.fetchRecentTraces(START, NOW);

    assertThat(traces).extracting(t -> t.get("traceID").asText())
      .containsExactly(FIRST, SECOND);
    assertThat(traces.get(0).has("batches")).isTrue();
  }

  @Test void fetchRecentTraces_skipsTraceThatFails() {
    expectSearch();
    server.expect(requestTo("http://tempo:3200/api/traces/" + FIRST))
      .andRespond(withServerError());
    server.expect(requestTo("http://tempo:3200/api/traces/" + SECOND))
      .andRespond(withSuccess(fixtureText("tempo-trace.json"), MediaType.APPLICATION_JSON));

    List<JsonNode> traces = engine.fetchRecentTraces(START, NOW);

    assertThat(traces).extracting(t -> t.get("traceID").asText()).containsExactly(SECOND);
  }

  @Test void fetchRecentTraces_unreachableDuringFetchPropagates() {
    expectSearch();
    server.expect(requestTo("http://tempo:3200/api/traces/" + FIRST))
      .andRespond(request -> {
        throw new ConnectException("Connection refused");
      });

    assertThatThrownBy(() -> engine.fetchRecentTraces(START, NOW))
      .isInstanceOf(ResourceAccessException.class);
  }

  @Test void fetchRecentTraces_emptySearch() {
    server.expect(requestTo(startsWith("http://tempo:3200/api/search")))
      .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    assertThat(engine.fetchRecentTraces(START, NOW)).isEmpty();
  }

  @Test void testConnection() {
    server.expect(requestTo("http://tempo:3200/ready"))
      .andRespond(withSuccess());

    assertThat(engine.testConnection()).isTrue();
  }

  @Test void testConnection_unreachable() {
    server.expect(requestTo("http://tempo:3200/ready"))
      .andRespond(request -> {
        throw new ConnectException("Connection refused");
      });

    assertThat(engine.testConnection()).isFalse();
  }
}
