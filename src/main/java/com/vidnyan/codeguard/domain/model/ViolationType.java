package com.vidnyan.codeguard.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of per-file findings.
 */
public enum ViolationType {
    NULL_SAFETY("null_safety"),
    COLLECTION_SAFETY("collection_safety"),
    EXTERNAL_CALL_SAFETY("external_call_safety"),
    TIMEOUT_PRESENCE("timeout_presence"),
    TYPE_SAFETY("type_safety"),
    BOUNDS_SAFETY("bounds_safety"),
    EXCEPTION_HANDLING("exception_handling"),
    CONCURRENCY_SAFETY("concurrency_safety"),
    ERROR_HANDLING_MISSING("error_handling_missing"),
    BUSINESS_LOGIC_INCOMPLETE("business_logic_incomplete"),
    SQL_INJECTION("sql_injection"),
    PII_IN_LOGS("pii_in_logs"),
    MISSING_AUTHORIZATION("missing_authorization"),
    NON_STANDARD_ERROR_CODE("non_standard_error_code"),
    NON_STANDARD_TIMEOUT("non_standard_timeout"),
    UNIX_TIMESTAMP_USAGE("unix_timestamp_usage"),
    CUSTOM_DATETIME_FORMAT("custom_datetime_format");

    private final String id;

    ViolationType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public static ViolationType fromId(String id) {
        for (ViolationType type : values()) {
            if (type.id.equalsIgnoreCase(id) || type.name().equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown violation type: " + id);
    }
}
