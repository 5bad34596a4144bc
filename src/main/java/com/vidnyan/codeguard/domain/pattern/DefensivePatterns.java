package com.vidnyan.codeguard.domain.pattern;

import java.util.List;
import java.util.Set;

/**
 * Knobs of the defensive-programming detectors.
 *
 * @param safeReceivers   receivers never null-checked ({@code log}, {@code this})
 * @param allowedPackages package roots appearing as the head of a qualified name
 */
public record DefensivePatterns(
    int lookbackLines,
    Set<String> safeAccessors,
    Set<String> safeReceivers,
    Set<String> allowedPackages,
    Set<String> emptyUnsafeCalls,
    List<ExternalCallSpec> externalCalls,
    List<String> conversions
) {

    public DefensivePatterns {
        safeAccessors = Set.copyOf(safeAccessors);
        safeReceivers = Set.copyOf(safeReceivers);
        allowedPackages = Set.copyOf(allowedPackages);
        emptyUnsafeCalls = Set.copyOf(emptyUnsafeCalls);
        externalCalls = List.copyOf(externalCalls);
        conversions = List.copyOf(conversions);
    }

    public DefensivePatterns withLookbackLines(int lines) {
        return new DefensivePatterns(lines, safeAccessors, safeReceivers, allowedPackages,
                emptyUnsafeCalls, externalCalls, conversions);
    }
}
