package com.vidnyan.codeguard.domain.pattern;

import java.util.List;

/**
 * Settings of the component dependency analysis.
 */
public record IntegrationSettings(
    int timeoutOverheadSeconds,
    List<String> errorHandlingKeywords,
    List<String> retryKeywords
) {

    public IntegrationSettings {
        errorHandlingKeywords = List.copyOf(errorHandlingKeywords);
        retryKeywords = List.copyOf(retryKeywords);
    }
}
