package com.flowlens.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ServiceInfo {
    String name;
    String namespace;
    String pod;
    String version;
}
