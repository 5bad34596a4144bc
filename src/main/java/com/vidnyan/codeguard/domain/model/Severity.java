package com.vidnyan.codeguard.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Finding severity levels, most severe first.
 */
public enum Severity {
    CRITICAL("critical"),  // fails the run
    WARNING("warning"),
    INFO("info");

    private final String id;

    Severity(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Parse a configured severity, accepting the common aliases.
     */
    public static Severity parse(String value, Severity fallback) {
        if (value == null || value.isBlank()) return fallback;
        return switch (value.trim().toUpperCase()) {
            case "CRITICAL", "BLOCKER", "ERROR", "HIGH" -> CRITICAL;
            case "WARNING", "WARN", "MEDIUM" -> WARNING;
            case "INFO", "LOW" -> INFO;
            default -> fallback;
        };
    }
}
