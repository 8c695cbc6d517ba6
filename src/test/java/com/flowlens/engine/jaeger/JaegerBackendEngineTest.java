package com.flowlens.engine.jaeger;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.config.CollectorProperties;
import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import static com.flowlens.TestObjects.NOW;
import static com.flowlens.TestObjects.fixtureText;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class JaegerBackendEngineTest {
  static final Instant START = NOW.minus(Duration.ofMinutes(5));

  RestClient.Builder builder = RestClient.builder();
  MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
  CollectorProperties properties = new CollectorProperties();
  JaegerBackendEngine engine;

  {
    properties.setJaegerUrl("http://jaeger:16686");
    properties.setServiceName("ccs-api");
    properties.setLimit(50);
    engine = new JaegerBackendEngine(builder.build(), properties);
  }

  @AfterEach void verify() {
    server.verify();
  }

  @Test void fetchRecentTraces_queriesInMicroseconds() {
    server.expect(requestTo(startsWith("http://jaeger:16686/api/traces")))
      .andExpect(method(HttpMethod.GET))
      .andExpect(queryParam("service", "ccs-api"))
      .andExpect(queryParam("start", "1700000000000000"))
      .andExpect(queryParam("end", "1700000300000000"))
      .andExpect(queryParam("limit", "50"))
      .andRespond(withSuccess(fixtureText("jaeger-search-response.json"), MediaType.APPLICATION_JSON));

    List<JsonNode> traces = engine.fetchRecentTraces(START, NOW);

    assertThat(traces).extracting(t -> t.get("traceID").asText())
      .containsExactly("4bf92f3577b34da6a3ce929d0e0e4736", "5cf92f3577b34da6a3ce929d0e0e4737");
  }

  @Test void fetchRecentTraces_noData() {
    server.expect(requestTo(startsWith("http://jaeger:16686/api/traces")))
      .andRespond(withSuccess("{\"data\":null}", MediaType.APPLICATION_JSON));

    assertThat(engine.fetchRecentTraces(START, NOW)).isEmpty();
  }

  @Test void fetchRecentTraces_serverErrorPropagates() {
    server.expect(requestTo(startsWith("http://jaeger:16686/api/traces")))
      .andRespond(withServerError());

    assertThatThrownBy(() -> engine.fetchRecentTraces(START, NOW))
      .isInstanceOf(HttpServerErrorException.class);
  }

  @Test void fetchRecentTraces_unreachable() {
    server.expect(requestTo(startsWith("http://jaeger:16686/api/traces")))
      .andRespond(request -> {
        throw new ConnectException("Connection refused");
      });

    assertThatThrownBy(() -> engine.fetchRecentTraces(START, NOW))
      .isInstanceOf(ResourceAccessException.class);
  }

  @Test void testConnection() {
    server.expect(requestTo("http://jaeger:16686/api/services"))
      .andRespond(withSuccess("{\"data\":[\"ccs-api\"]}", MediaType.APPLICATION_JSON));

    assertThat(engine.testConnection()).isTrue();
  }

  @Test void testConnection_failure() {
    server.expect(requestTo("http://jaeger:16686/api/services"))
      .andRespond(withServerError());

    assertThat(engine.testConnection()).isFalse();
  }

  @Test void toMicros() {
    assertThat(JaegerBackendEngine.toMicros(Instant.ofEpochSecond(1, 2_500)))
      .isEqualTo(1_000_002L);
  }
}
