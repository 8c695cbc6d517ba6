package com.flowlens.normalizer;

import java.util.List;
import java.util.Map;

/**
 * Logical span fields and the attribute keys they may be published under, most specific first.
 * New backends add aliases here rather than branching in the normalizers.
 */
public enum AttributeField {
    SERVICE_NAME("service.name", "k8s.deployment.name"),
    NAMESPACE("k8s.namespace.name", "k8s.namespace", "namespace"),
    POD_NAME("k8s.pod.name", "k8s.pod"),
    SERVICE_VERSION("service.version"),
    ENVIRONMENT("deployment.environment", "deployment.environment.name"),
    OPERATION_NAME("operation.name"),
    UI_EVENT("ui.event", "ui.action");

    private final List<String> keys;

    AttributeField(String... keys) {
        this.keys = List.of(keys);
    }

    public List<String> getKeys() {
        return keys;
    }

    /**
     * Looks the field up scope by scope (span level first), trying every alias within a scope
     * before moving to the next one.
     *
     * @return the first non-blank value, or null
     */
    public String resolve(List<Map<String, String>> scopes) {
        for (Map<String, String> scope : scopes) {
            if (scope == null) continue;
            for (String key : keys) {
                String value = scope.get(key);
                if (value != null && !value.isBlank()) {
                    return value;
                }
            }
        }
        return null;
    }
}
