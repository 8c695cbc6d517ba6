package com.flowlens.model;

public enum SpanStatus {
    OK,
    ERROR;

    public boolean isError() {
        return this == ERROR;
    }
}
