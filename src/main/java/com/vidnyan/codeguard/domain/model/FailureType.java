package com.vidnyan.codeguard.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of integration failures predicted between components.
 */
public enum FailureType {
    DATA_FORMAT_MISMATCH("data_format_mismatch"),
    MISSING_ERROR_HANDLING("missing_error_handling"),
    MISSING_RETRY_LOGIC("missing_retry_logic"),
    TIMEOUT_CASCADE("timeout_cascade"),
    CIRCULAR_DEPENDENCY("circular_dependency");

    private final String id;

    FailureType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
