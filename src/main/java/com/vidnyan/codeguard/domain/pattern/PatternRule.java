package com.vidnyan.codeguard.domain.pattern;

import com.vidnyan.codeguard.domain.model.Severity;

import java.util.List;

/**
 * Declarative rule: what to detect, what must be present, how severe a miss is.
 * Immutable and shared read-only by all analyzers.
 */
public record PatternRule(
    String id,
    String description,
    List<String> detectionPatterns,
    List<RequiredElement> requiredElements,
    Severity severity,
    String fixStrategy,
    String testGeneration
) {

    public PatternRule {
        detectionPatterns = List.copyOf(detectionPatterns);
        requiredElements = List.copyOf(requiredElements);
    }

    public String displayName() {
        if (description != null && !description.isBlank()) {
            return description;
        }
        String words = id.replace('_', ' ');
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }
}
