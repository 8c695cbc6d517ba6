package com.flowlens.normalizer;

import com.flowlens.model.TraceFormat;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the normalizer for a wire format.
 */
@Component
public class SpanNormalizers {

    private final Map<TraceFormat, SpanNormalizer> byFormat = new EnumMap<>(TraceFormat.class);

    public SpanNormalizers(List<SpanNormalizer> normalizers) {
        for (SpanNormalizer normalizer : normalizers) {
            byFormat.put(normalizer.getFormat(), normalizer);
        }
    }

    public SpanNormalizer forFormat(TraceFormat format) {
        SpanNormalizer normalizer = byFormat.get(format);
        if (normalizer == null) {
            throw new IllegalArgumentException("No normalizer registered for format " + format);
        }
        return normalizer;
    }
}
