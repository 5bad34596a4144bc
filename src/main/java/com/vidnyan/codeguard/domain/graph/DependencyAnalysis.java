package com.vidnyan.codeguard.domain.graph;

import com.vidnyan.codeguard.domain.model.AnalysisNote;
import com.vidnyan.codeguard.domain.model.PredictedFailure;

import java.util.List;

/**
 * Result of analyzing the component graph of one repository.
 */
public record DependencyAnalysis(
    ComponentGraph graph,
    List<PredictedFailure> failures,
    List<AnalysisNote> notes
) {

    public DependencyAnalysis {
        failures = List.copyOf(failures);
        notes = List.copyOf(notes);
    }

    /**
     * No components to analyze; only the notes gathered while looking for them.
     */
    public static DependencyAnalysis withoutComponents(List<AnalysisNote> notes) {
        return new DependencyAnalysis(ComponentGraph.of(List.of(), List.of()), List.of(), notes);
    }
}
