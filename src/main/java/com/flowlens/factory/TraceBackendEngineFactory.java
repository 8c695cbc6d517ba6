package com.flowlens.factory;

import com.flowlens.engine.TraceBackendEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import jakarta.annotation.PostConstruct;

@Slf4j
@Component
public class TraceBackendEngineFactory {

    private final TraceBackendEngine engine;  // the one matching flowlens.collector.backend

    @Autowired
    public TraceBackendEngineFactory(TraceBackendEngine engine) {
        this.engine = engine;
    }

    @PostConstruct
    public void init() {
        log.info("FlowLens tracing backend initialized: {}", engine.getEngineType());
    }

    public TraceBackendEngine getEngine() {
        return engine;
    }
}
