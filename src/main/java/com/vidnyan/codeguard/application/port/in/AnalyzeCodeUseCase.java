package com.vidnyan.codeguard.application.port.in;

import com.vidnyan.codeguard.domain.report.AnalysisReport;

import java.nio.file.Path;

/**
 * Primary use case: analyze a repository for defensive, semantic and integration issues.
 * This is the main entry point to the application.
 */
public interface AnalyzeCodeUseCase {

    /**
     * Analyze a repository and return the aggregated report.
     * @param request Analysis request parameters
     * @param cancellation checked before each file; a cancelled run reports the files already finished
     * @return Analysis result with the report and run statistics
     */
    AnalysisResult analyze(AnalysisRequest request, CancellationToken cancellation);

    default AnalysisResult analyze(AnalysisRequest request) {
        return analyze(request, CancellationToken.create());
    }

    /**
     * Analysis request parameters.
     *
     * @param lookbackLines lines above a finding searched for guards; null to use the pattern library's value
     */
    record AnalysisRequest(
        Path repositoryPath,
        boolean includeTests,
        Integer lookbackLines,
        int workerThreads,
        String componentsDir,
        String contractsDir
    ) {
        public static AnalysisRequest forPath(Path path) {
            return new AnalysisRequest(path, false, null, Runtime.getRuntime().availableProcessors(),
                    "components", "contracts");
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        AnalysisReport report,
        AnalysisStats stats,
        boolean cancelled
    ) {
        public boolean hasCriticalFindings() {
            return report.hasCritical();
        }

        public int exitCode() {
            return report.exitCode();
        }
    }

    /**
     * Analysis statistics. Kept out of the report so reports stay reproducible.
     */
    record AnalysisStats(
        int filesScanned,
        int filesAnalyzed,
        int filesSkipped,
        int detectorsRun,
        int componentsAnalyzed,
        long totalDurationMs
    ) {}
}
