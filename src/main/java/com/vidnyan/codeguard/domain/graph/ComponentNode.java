package com.vidnyan.codeguard.domain.graph;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A deployable unit of the analyzed system: a directory of sources with an optional contract.
 */
public record ComponentNode(
    String name,
    Path directory,
    List<Path> sourceFiles,
    ComponentContract contract
) {

    public ComponentNode {
        sourceFiles = List.copyOf(sourceFiles);
    }

    public Optional<ComponentContract> contractIfPresent() {
        return Optional.ofNullable(contract);
    }

    public Optional<Integer> timeoutSeconds() {
        return contractIfPresent().flatMap(ComponentContract::timeout);
    }

    /**
     * Name as it appears in package segments: lower case, without {@code -} and {@code _}.
     */
    public String normalizedName() {
        return normalize(name);
    }

    public static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
    }
}
