package com.vidnyan.codeguard.domain.pattern;

import com.vidnyan.codeguard.domain.model.Severity;

import java.util.List;

/**
 * One checklist item of a business-flow rule: satisfied when any keyword
 * appears in the function body.
 *
 * @param severity overrides the rule severity when not null
 */
public record RequiredElement(
    String name,
    List<String> keywords,
    Severity severity,
    String fixStrategy
) {

    public RequiredElement {
        keywords = List.copyOf(keywords);
    }

    public Severity effectiveSeverity(PatternRule rule) {
        return severity != null ? severity : rule.severity();
    }

    public String effectiveFix() {
        return fixStrategy != null && !fixStrategy.isBlank()
                ? fixStrategy
                : "Implement " + name.replace('_', ' ');
    }
}
