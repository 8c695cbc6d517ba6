package com.flowlens.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Slf4j
@Configuration
public class TracingClientConfiguration {

    @Bean
    public RestClient tracingRestClient(RestClient.Builder builder, CollectorProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeoutMs());
        requestFactory.setReadTimeout(properties.getReadTimeoutMs());

        log.info("Tracing backend client timeouts: connect={}ms, read={}ms",
                properties.getConnectTimeoutMs(), properties.getReadTimeoutMs());

        return builder
                .requestFactory(requestFactory)
                .defaultHeader("Accept", "application/json")
                .defaultHeader("User-Agent", "FlowLens/1.0")
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
