package com.flowlens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class FlowMetadata {
    String namespace;
    String environment;
    int totalSpans;
    int serviceCount;
    int errorCount;
    List<String> namespaces;
    Map<String, List<String>> servicesByNamespace;
}
