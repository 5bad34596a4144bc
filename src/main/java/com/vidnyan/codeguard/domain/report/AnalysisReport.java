package com.vidnyan.codeguard.domain.report;

import com.vidnyan.codeguard.domain.model.AnalysisNote;
import com.vidnyan.codeguard.domain.model.PredictedFailure;
import com.vidnyan.codeguard.domain.model.Violation;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Final output of a run: findings sorted for reproducible output, with summary counts.
 * Built by {@link ReportAggregator}.
 */
@Value
@Builder
public class AnalysisReport {
    Summary summary;
    List<Violation> violations;
    List<PredictedFailure> predictedFailures;
    List<AnalysisNote> notes;

    /**
     * Counts over violations and predicted failures together. Notes are not counted.
     */
    @Value
    @Builder
    public static class Summary {
        int total;
        int critical;
        int warning;
        int info;
        Map<String, Integer> byType;
        int filesAnalyzed;
        int filesSkipped;
    }

    public boolean hasCritical() {
        return summary.getCritical() > 0;
    }

    /**
     * Process exit code: 1 when any finding is critical.
     */
    public int exitCode() {
        return hasCritical() ? 1 : 0;
    }
}
