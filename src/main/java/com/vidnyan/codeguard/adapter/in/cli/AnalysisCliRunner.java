package com.vidnyan.codeguard.adapter.in.cli;

import com.vidnyan.codeguard.AnalysisProperties;
import com.vidnyan.codeguard.application.port.in.AnalyzeCodeUseCase;
import com.vidnyan.codeguard.application.port.in.AnalyzeCodeUseCase.AnalysisRequest;
import com.vidnyan.codeguard.application.port.in.AnalyzeCodeUseCase.AnalysisResult;
import com.vidnyan.codeguard.application.port.out.ReportRenderer;
import com.vidnyan.codeguard.domain.exception.CodeGuardException;
import com.vidnyan.codeguard.domain.report.AnalysisReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI Runner for standalone code analysis.
 * Runs analysis when codeguard.analysis.repository-path is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AnalyzeCodeUseCase analyzeCodeUseCase;
    private final AnalysisProperties properties;
    private final List<ReportRenderer> renderers;

    private int exitCode = 0;

    @Override
    public void run(String... args) throws Exception {
        String sourcePath = properties.getRepositoryPath();
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No repository path specified. Set codeguard.analysis.repository-path property.");
            return;
        }

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║           CodeGuard - Defensive & Semantic Analysis          ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Analyzing: {}", truncatePath(sourcePath, 50));
        log.info("╚══════════════════════════════════════════════════════════════╝");

        ReportRenderer renderer = rendererFor(properties.getReportFormat());

        AnalysisRequest request = new AnalysisRequest(
                Path.of(sourcePath),
                properties.isIncludeTests(),
                properties.getLookbackLines(),
                properties.getWorkerThreads(),
                properties.getComponentsDir(),
                properties.getContractsDir());
        AnalysisResult result = analyzeCodeUseCase.analyze(request);

        printResults(result);
        writeReport(renderer.render(result.report()));

        if (properties.isFailOnCritical()) {
            exitCode = result.exitCode();
        }
        log.info("");
        log.info("Analysis complete!");
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private ReportRenderer rendererFor(String format) {
        return renderers.stream()
                .filter(r -> r.format().equalsIgnoreCase(format))
                .findFirst()
                .orElseThrow(() -> new CodeGuardException("Unknown report format: " + format));
    }

    private void writeReport(String rendered) throws IOException {
        String output = properties.getReportOutput();
        if (output == null || output.isBlank()) {
            System.out.print(rendered);
            return;
        }
        Path target = Path.of(output);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, rendered, StandardCharsets.UTF_8);
        log.info("Report written to {}", target.toAbsolutePath());
    }

    private void printResults(AnalysisResult result) {
        AnalysisReport.Summary summary = result.report().getSummary();
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS{}", result.cancelled() ? " (cancelled)" : "");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files scanned:    {}", result.stats().filesScanned());
        log.info(" Files analyzed:   {}", result.stats().filesAnalyzed());
        log.info(" Files skipped:    {}", result.stats().filesSkipped());
        log.info(" Detectors run:    {}", result.stats().detectorsRun());
        log.info(" Components:       {}", result.stats().componentsAnalyzed());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" FINDINGS:");
        log.info("   Critical: {}", summary.getCritical());
        log.info("   Warning:  {}", summary.getWarning());
        log.info("   Info:     {}", summary.getInfo());
        log.info("═══════════════════════════════════════════════════════════════");
        if (summary.getTotal() == 0) {
            log.info("No issues found.");
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
