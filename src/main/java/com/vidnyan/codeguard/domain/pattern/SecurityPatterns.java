package com.vidnyan.codeguard.domain.pattern;

import java.util.List;
import java.util.Set;

/**
 * Inputs of the security scanner.
 */
public record SecurityPatterns(
    List<String> sqlKeywords,
    List<String> piiKeywords,
    Set<String> loggerMethods,
    Set<String> printCalls,
    Set<String> endpointAnnotations,
    Set<String> authorizationAnnotations,
    Set<String> publicEndpoints
) {

    public SecurityPatterns {
        sqlKeywords = List.copyOf(sqlKeywords);
        piiKeywords = List.copyOf(piiKeywords);
        loggerMethods = Set.copyOf(loggerMethods);
        printCalls = Set.copyOf(printCalls);
        endpointAnnotations = Set.copyOf(endpointAnnotations);
        authorizationAnnotations = Set.copyOf(authorizationAnnotations);
        publicEndpoints = Set.copyOf(publicEndpoints);
    }
}
