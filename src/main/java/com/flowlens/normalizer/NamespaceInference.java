package com.flowlens.normalizer;

import com.flowlens.config.NormalizerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fills in a namespace for spans that don't carry one, from configured service-name patterns.
 */
@Component
@RequiredArgsConstructor
public class NamespaceInference {

    public static final String DEFAULT_NAMESPACE = "default";

    private final NormalizerProperties properties;

    public String resolve(String namespace, String serviceName) {
        if (namespace != null && !namespace.isBlank() && !DEFAULT_NAMESPACE.equals(namespace)) {
            return namespace;
        }
        String inferred = infer(serviceName);
        return inferred != null ? inferred : DEFAULT_NAMESPACE;
    }

    public String infer(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            return null;
        }
        String service = serviceName.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : properties.getNamespacePatterns().entrySet()) {
            for (String pattern : entry.getValue()) {
                if (pattern != null && !pattern.isBlank()
                        && service.contains(pattern.toLowerCase(Locale.ROOT))) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }
}
