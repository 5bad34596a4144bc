package com.vidnyan.codeguard.domain.graph;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Facts read from a component's API contract.
 *
 * @param timeoutSeconds {@code x-timeout} of the contract, null when it declares none
 * @param datetimeFormat ISO8601, Unix timestamp or RFC3339, null when unknown
 * @param idFormat       UUID, integer or string, null when unknown
 * @param enums          enum values by path inside the contract
 * @param nullables      nullable flags by path inside the contract
 */
public record ComponentContract(
    String component,
    Integer timeoutSeconds,
    String datetimeFormat,
    String idFormat,
    Map<String, List<Object>> enums,
    Map<String, Boolean> nullables
) {

    public ComponentContract {
        enums = Map.copyOf(enums);
        nullables = Map.copyOf(nullables);
    }

    public Optional<Integer> timeout() {
        return Optional.ofNullable(timeoutSeconds);
    }
}
