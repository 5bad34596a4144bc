package com.vidnyan.codeguard.application.port.out;

import com.vidnyan.codeguard.domain.graph.ComponentNode;
import com.vidnyan.codeguard.domain.model.AnalysisNote;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for discovering the components of the analyzed system and their contracts.
 */
public interface ComponentRepository {

    /**
     * Load every component below {@code root/componentsDir}, sorted by name,
     * with its contract from {@code root/contractsDir} when one exists.
     * A missing components directory yields an empty list. Contracts that cannot
     * be read, fully or partly, are reported through {@code notes}.
     */
    List<ComponentNode> findComponents(Path root, String componentsDir, String contractsDir,
                                       List<AnalysisNote> notes);
}
