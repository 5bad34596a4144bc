package com.vidnyan.codeguard.domain.report;

import com.vidnyan.codeguard.domain.model.AnalysisNote;
import com.vidnyan.codeguard.domain.model.PredictedFailure;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects per-file and per-component results of one run.
 * <p>
 * Workers append concurrently; every append takes the aggregator's lock and
 * receives a complete per-file result, so a cancelled run never holds half a file.
 * Use a fresh instance per run.
 */
public class ReportAggregator {

    static final Comparator<Violation> VIOLATION_ORDER = Comparator
            .comparing(Violation::severity)
            .thenComparing(Violation::file)
            .thenComparingInt(Violation::line)
            .thenComparing(v -> v.type().id())
            .thenComparing(Violation::description);

    static final Comparator<PredictedFailure> FAILURE_ORDER = Comparator
            .comparing(PredictedFailure::severity)
            .thenComparing(f -> f.type().id())
            .thenComparing(PredictedFailure::componentA)
            .thenComparing(PredictedFailure::componentB)
            .thenComparing(PredictedFailure::description);

    static final Comparator<AnalysisNote> NOTE_ORDER = Comparator
            .comparing(AnalysisNote::file)
            .thenComparing(AnalysisNote::kind)
            .thenComparing(AnalysisNote::message);

    private final List<Violation> violations = new ArrayList<>();
    private final List<PredictedFailure> predictedFailures = new ArrayList<>();
    private final List<AnalysisNote> notes = new ArrayList<>();
    private int filesAnalyzed;

    public synchronized void addFileResult(String file, List<Violation> fileViolations) {
        filesAnalyzed++;
        violations.addAll(fileViolations);
    }

    public synchronized void addPredictedFailures(List<PredictedFailure> failures) {
        predictedFailures.addAll(failures);
    }

    public synchronized void addNote(AnalysisNote note) {
        notes.add(note);
    }

    public synchronized int filesAnalyzed() {
        return filesAnalyzed;
    }

    /**
     * Deduplicate, sort and count everything collected so far.
     */
    public synchronized AnalysisReport build() {
        List<Violation> sortedViolations = dedupAndSort(violations, VIOLATION_ORDER);
        List<PredictedFailure> sortedFailures = dedupAndSort(predictedFailures, FAILURE_ORDER);
        List<AnalysisNote> sortedNotes = dedupAndSort(notes, NOTE_ORDER);

        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        Map<String, Integer> byType = new TreeMap<>();
        for (Violation v : sortedViolations) {
            bySeverity.merge(v.severity(), 1, Integer::sum);
            byType.merge(v.type().id(), 1, Integer::sum);
        }
        for (PredictedFailure f : sortedFailures) {
            bySeverity.merge(f.severity(), 1, Integer::sum);
            byType.merge(f.type().id(), 1, Integer::sum);
        }

        AnalysisReport.Summary summary = AnalysisReport.Summary.builder()
                .total(sortedViolations.size() + sortedFailures.size())
                .critical(bySeverity.getOrDefault(Severity.CRITICAL, 0))
                .warning(bySeverity.getOrDefault(Severity.WARNING, 0))
                .info(bySeverity.getOrDefault(Severity.INFO, 0))
                .byType(Collections.unmodifiableMap(byType))
                .filesAnalyzed(filesAnalyzed)
                .filesSkipped((int) sortedNotes.stream().map(AnalysisNote::file).distinct().count())
                .build();

        return AnalysisReport.builder()
                .summary(summary)
                .violations(sortedViolations)
                .predictedFailures(sortedFailures)
                .notes(sortedNotes)
                .build();
    }

    private static <T> List<T> dedupAndSort(List<T> items, Comparator<T> order) {
        List<T> unique = new ArrayList<>(new LinkedHashSet<>(items));
        unique.sort(order);
        return List.copyOf(unique);
    }
}
