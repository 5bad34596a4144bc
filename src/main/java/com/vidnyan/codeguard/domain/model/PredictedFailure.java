package com.vidnyan.codeguard.domain.model;

/**
 * A failure predicted at the boundary between two components.
 */
public record PredictedFailure(
    FailureType type,
    String componentA,
    String componentB,
    String description,
    Severity severity,
    String fixStrategy,
    String testGeneration
) {

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
