package com.vidnyan.codeguard.application.service;

import com.vidnyan.codeguard.application.port.in.AnalyzeCodeUseCase;
import com.vidnyan.codeguard.application.port.in.CancellationToken;
import com.vidnyan.codeguard.domain.context.ContextWindow;
import com.vidnyan.codeguard.domain.exception.CodeGuardException;
import com.vidnyan.codeguard.domain.graph.DependencyAnalysis;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import com.vidnyan.codeguard.domain.report.AnalysisReport;
import com.vidnyan.codeguard.domain.report.ReportAggregator;
import com.vidnyan.codeguard.scanner.RepositoryScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main application service that orchestrates the analysis workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisApplicationService implements AnalyzeCodeUseCase {

    private final RepositoryScanner repositoryScanner;
    private final FileAnalyzer fileAnalyzer;
    private final DependencyGraphAnalyzer dependencyGraphAnalyzer;
    private final PatternLibrary patternLibrary;

    @Override
    public AnalysisResult analyze(AnalysisRequest request, CancellationToken cancellation) {
        Instant startTime = Instant.now();
        Path root = request.repositoryPath().toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new CodeGuardException("Repository path is not a directory: " + root);
        }
        log.info("Starting analysis of: {}", root);

        PatternLibrary patterns = request.lookbackLines() != null
                ? patternLibrary.withLookbackLines(request.lookbackLines())
                : patternLibrary;
        ContextWindow window = new ContextWindow(patterns.defensive().lookbackLines());
        ReportAggregator aggregator = new ReportAggregator();

        // Step 1: Scan source files
        log.info("Step 1: Scanning source files...");
        List<Path> files;
        try {
            files = repositoryScanner.scanSourceFiles(root, request.includeTests());
        } catch (IOException e) {
            throw new CodeGuardException("Failed to scan " + root + ": " + e.getMessage(), e);
        }
        log.info("Found {} source files", files.size());

        // Step 2: Run detectors
        log.info("Step 2: Running {} detectors (lookback {} lines)...",
                fileAnalyzer.detectorCount(), window.lookbackLines());
        int skipped = analyzeFiles(files, root, patterns, window, aggregator, request.workerThreads(), cancellation);

        // Step 3: Analyze component dependencies
        int components = 0;
        if (!cancellation.isCancelled()) {
            log.info("Step 3: Analyzing component dependencies...");
            DependencyAnalysis dependencies = dependencyGraphAnalyzer.analyze(
                    root, request.componentsDir(), request.contractsDir(), patterns, window);
            aggregator.addPredictedFailures(dependencies.failures());
            dependencies.notes().forEach(aggregator::addNote);
            components = dependencies.graph().nodes().size();
        } else {
            log.warn("Analysis cancelled; skipping component dependencies");
        }

        // Step 4: Aggregate
        log.info("Step 4: Aggregating results...");
        AnalysisReport report = aggregator.build();

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                files.size(),
                aggregator.filesAnalyzed(),
                skipped,
                fileAnalyzer.detectorCount(),
                components,
                totalDuration.toMillis()
        );

        log.info("Analysis complete: {} findings ({} critical) in {}ms",
                report.getSummary().getTotal(), report.getSummary().getCritical(), stats.totalDurationMs());
        return new AnalysisResult(report, stats, cancellation.isCancelled());
    }

    /**
     * Analyze files on a bounded worker pool. Returns the number of skipped files.
     */
    private int analyzeFiles(List<Path> files, Path root, PatternLibrary patterns, ContextWindow window,
                             ReportAggregator aggregator, int workerThreads, CancellationToken cancellation) {
        int workers = Math.max(1, Math.min(workerThreads, Runtime.getRuntime().availableProcessors()));
        AtomicInteger skipped = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> {
                    if (cancellation.isCancelled()) {
                        return;
                    }
                    FileAnalyzer.FileAnalysis result = fileAnalyzer.analyze(file, root, patterns, window);
                    if (result.isSkipped()) {
                        skipped.incrementAndGet();
                        aggregator.addNote(result.note());
                    } else {
                        aggregator.addFileResult(result.path(), result.violations());
                    }
                }));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.error("File analysis failed: {}", e.getCause().getMessage(), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            log.warn("Analysis interrupted; reporting completed files only");
        } finally {
            executor.shutdownNow();
        }
        log.info("Analyzed {} files with {} workers ({} skipped)", aggregator.filesAnalyzed(), workers, skipped.get());
        return skipped.get();
    }
}
