package com.vidnyan.codeguard.domain.pattern;

import com.vidnyan.codeguard.domain.model.FailureType;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * All declarative rules of one run.
 * Loaded once before any file is analyzed, then shared read-only by every worker.
 *
 * @param source where the rules came from, for logging
 */
public record PatternLibrary(
    Map<String, PatternRule> businessRules,
    Map<String, PatternRule> integrationRules,
    DefensivePatterns defensive,
    List<OperationRequirement> errorHandlingRequirements,
    SecurityPatterns security,
    CodingStandards standards,
    IntegrationSettings integration,
    String source
) {

    public PatternLibrary {
        businessRules = sortedCopy(businessRules);
        integrationRules = sortedCopy(integrationRules);
        errorHandlingRequirements = List.copyOf(errorHandlingRequirements);
    }

    /**
     * Minimal rule set used when no configuration can be read.
     */
    public static PatternLibrary builtInDefaults() {
        return new PatternLibrary(
                BuiltInPatterns.businessRules(),
                BuiltInPatterns.integrationRules(),
                BuiltInPatterns.defensive(),
                BuiltInPatterns.errorHandlingRequirements(),
                BuiltInPatterns.security(),
                BuiltInPatterns.standards(),
                BuiltInPatterns.integration(),
                "built-in defaults");
    }

    /**
     * Business-flow rules in id order.
     */
    public Collection<PatternRule> businessFlows() {
        return businessRules.values();
    }

    public Optional<PatternRule> businessRule(String id) {
        return Optional.ofNullable(businessRules.get(id));
    }

    /**
     * Configured rule for an integration failure type, or its built-in default.
     */
    public PatternRule integrationRule(FailureType type) {
        PatternRule rule = integrationRules.get(type.id());
        return rule != null ? rule : BuiltInPatterns.integrationRules().get(type.id());
    }

    public PatternLibrary withLookbackLines(int lines) {
        return new PatternLibrary(businessRules, integrationRules, defensive.withLookbackLines(lines),
                errorHandlingRequirements, security, standards, integration, source);
    }

    public int ruleCount() {
        return businessRules.size() + integrationRules.size() + errorHandlingRequirements.size();
    }

    private static Map<String, PatternRule> sortedCopy(Map<String, PatternRule> rules) {
        return Collections.unmodifiableMap(new TreeMap<>(rules));
    }
}
