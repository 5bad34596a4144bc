package com.vidnyan.codeguard.domain.model;

/**
 * A single finding inside one source file.
 * Immutable value object.
 */
public record Violation(
    Location location,
    ViolationType type,
    Severity severity,
    String description,
    String snippet,
    String suggestion
) {

    public String file() {
        return location.filePath();
    }

    public int line() {
        return location.line();
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }

    /**
     * Builder for Violation.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Location location;
        private ViolationType type;
        private Severity severity = Severity.WARNING;
        private String description;
        private String snippet = "";
        private String suggestion = "";

        public Builder location(Location loc) { this.location = loc; return this; }
        public Builder type(ViolationType type) { this.type = type; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder snippet(String code) { this.snippet = code == null ? "" : code.strip(); return this; }
        public Builder suggestion(String fix) { this.suggestion = fix == null ? "" : fix; return this; }

        public Violation build() {
            if (location == null || type == null) {
                throw new IllegalStateException("Violation needs a location and a type");
            }
            return new Violation(location, type, severity, description == null ? "" : description,
                    snippet, suggestion);
        }
    }
}
