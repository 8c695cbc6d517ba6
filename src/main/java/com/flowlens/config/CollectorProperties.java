package com.flowlens.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Data
@ConfigurationProperties(prefix = "flowlens.collector")
public class CollectorProperties {
    private boolean enabled = true;
    private long intervalMs = 30000;
    private String backend = "jaeger";
    private String jaegerUrl = "http://localhost:16686";
    private String tempoUrl = "http://localhost:3200";
    private String serviceName = "qa-pr-dashboard-api";
    private List<String> namespaces = new ArrayList<>();
    private int lookbackMinutes = 5;
    private int limit = 100;
    private int connectTimeoutMs = 3000;
    private int readTimeoutMs = 10000;
    // Lets traces without namespace information through a non-empty allow-list
    private boolean developmentMode = true;

    public List<String> getAllowedNamespaces() {
        return namespaces.stream()
                .map(String::trim)
                .filter(ns -> !ns.isEmpty())
                .collect(Collectors.toList());
    }

    public String getBackendName() {
        return backend.trim().toLowerCase(Locale.ROOT);
    }
}
