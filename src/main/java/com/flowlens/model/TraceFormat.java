package com.flowlens.model;

import java.util.Locale;

/**
 * Wire format of a raw trace payload.
 */
public enum TraceFormat {
    JAEGER,
    TEMPO;

    public static TraceFormat fromName(String name) {
        return TraceFormat.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
