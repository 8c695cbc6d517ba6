package com.flowlens;

import com.flowlens.config.CollectorProperties;
import com.flowlens.config.NormalizerProperties;
import com.flowlens.config.StoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

/**
 * FlowLens - service flow analyzer for distributed traces
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({CollectorProperties.class, NormalizerProperties.class, StoreProperties.class})
public class FlowLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowLensApplication.class, args);
    }

    @Bean
    public CorsFilter corsFilter() {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowCredentials(true);
        config.addAllowedOriginPattern("*");
        config.addAllowedHeader("*");
        config.addAllowedMethod("*");
        source.registerCorsConfiguration("/**", config);
        return new CorsFilter(source);
    }
}
