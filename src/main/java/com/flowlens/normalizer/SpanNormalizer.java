package com.flowlens.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowlens.model.NormalizedTrace;
import com.flowlens.model.TraceFormat;

/**
 * Converts one backend-specific trace payload into the canonical span representation.
 */
public interface SpanNormalizer {

    TraceFormat getFormat();

    /**
     * @return the normalized trace, or null when the payload can't be analyzed. Never throws.
     */
    NormalizedTrace normalize(JsonNode rawTrace);
}
