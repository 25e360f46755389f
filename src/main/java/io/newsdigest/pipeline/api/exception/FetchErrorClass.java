package io.newsdigest.pipeline.api.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse error class reported per feed in the ingestion report.
 */
public enum FetchErrorClass {
    NETWORK("network"),
    HTTP_STATUS("http-status"),
    PARSE("parse"),
    TIMEOUT("timeout");

    private final String label;

    FetchErrorClass(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
