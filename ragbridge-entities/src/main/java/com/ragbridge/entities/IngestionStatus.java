package com.ragbridge.entities;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of an ingestion call. */
public enum IngestionStatus {
    COMPLETED("completed"), FAILED("failed");

    private final String code;

    IngestionStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
