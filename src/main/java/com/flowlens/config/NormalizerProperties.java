package com.flowlens.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "flowlens.normalizer")
public class NormalizerProperties {

    /**
     * Namespace to service-name substrings, checked in declaration order when a span carries no
     * namespace of its own.
     */
    private Map<String, List<String>> namespacePatterns = defaultPatterns();

    private static Map<String, List<String>> defaultPatterns() {
        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("ccs", List.of("ccs"));
        patterns.put("dbaas", List.of("dbaas"));
        return patterns;
    }
}
