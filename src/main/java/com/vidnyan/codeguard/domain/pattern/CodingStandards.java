package com.vidnyan.codeguard.domain.pattern;

import java.util.Set;

/**
 * Conventions shared by every component of the analyzed system.
 */
public record CodingStandards(
    Set<String> errorCodes,
    Set<Integer> timeoutsSeconds,
    Set<String> unixTimestampCalls,
    String datetimePatternPrefix
) {

    public CodingStandards {
        errorCodes = Set.copyOf(errorCodes);
        timeoutsSeconds = Set.copyOf(timeoutsSeconds);
        unixTimestampCalls = Set.copyOf(unixTimestampCalls);
    }
}
