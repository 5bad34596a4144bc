package com.vidnyan.codeguard.adapter.out.report;

import com.vidnyan.codeguard.application.port.out.ReportRenderer;
import com.vidnyan.codeguard.domain.model.AnalysisNote;
import com.vidnyan.codeguard.domain.model.PredictedFailure;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.report.AnalysisReport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable report for the console.
 */
@Component
public class TextReportRenderer implements ReportRenderer {

    private static final String RULE = "=".repeat(70);
    private static final String THIN_RULE = "-".repeat(70);

    @Override
    public String format() {
        return "text";
    }

    @Override
    public String render(AnalysisReport report) {
        AnalysisReport.Summary summary = report.getSummary();
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n')
           .append("CODEGUARD ANALYSIS REPORT").append('\n')
           .append(RULE).append("\n\n");

        out.append("Files analyzed: ").append(summary.getFilesAnalyzed()).append('\n')
           .append("Files skipped:  ").append(summary.getFilesSkipped()).append('\n')
           .append("Total findings: ").append(summary.getTotal()).append('\n')
           .append("  Critical: ").append(summary.getCritical()).append('\n')
           .append("  Warning:  ").append(summary.getWarning()).append('\n')
           .append("  Info:     ").append(summary.getInfo()).append("\n\n");

        if (!summary.getByType().isEmpty()) {
            out.append("Findings by type:").append('\n');
            summary.getByType().forEach((type, count) ->
                    out.append("  ").append(type).append(": ").append(count).append('\n'));
            out.append('\n');
        }

        for (Severity severity : Severity.values()) {
            List<Violation> violations = report.getViolations().stream()
                    .filter(v -> v.severity() == severity)
                    .toList();
            if (!violations.isEmpty()) {
                appendViolations(out, severity, violations);
            }
        }

        if (!report.getPredictedFailures().isEmpty()) {
            out.append(THIN_RULE).append('\n')
               .append("PREDICTED INTEGRATION FAILURES (").append(report.getPredictedFailures().size()).append(")\n")
               .append(THIN_RULE).append('\n');
            for (PredictedFailure f : report.getPredictedFailures()) {
                out.append("  [").append(f.severity().id().toUpperCase(Locale.ROOT)).append("] ")
                   .append(f.componentA()).append(" -> ").append(f.componentB())
                   .append(" (").append(f.type().id()).append(")\n")
                   .append("    Issue: ").append(f.description()).append('\n');
                if (f.fixStrategy() != null) {
                    out.append("    Fix: ").append(f.fixStrategy()).append('\n');
                }
                if (f.testGeneration() != null) {
                    out.append("    Test: ").append(f.testGeneration()).append('\n');
                }
            }
            out.append('\n');
        }

        if (!report.getNotes().isEmpty()) {
            out.append("NOTES").append('\n');
            for (AnalysisNote note : report.getNotes()) {
                out.append("  ").append(note.file()).append(": ").append(note.message()).append('\n');
            }
            out.append('\n');
        }

        out.append(RULE).append('\n')
           .append(report.hasCritical() ? "RESULT: FAILED (critical findings)" : "RESULT: PASSED").append('\n')
           .append(RULE).append('\n');
        return out.toString();
    }

    private void appendViolations(StringBuilder out, Severity severity, List<Violation> violations) {
        out.append(THIN_RULE).append('\n')
           .append(severity.name()).append(" (").append(violations.size()).append(")\n")
           .append(THIN_RULE).append('\n');

        Map<String, List<Violation>> byFile = new LinkedHashMap<>();
        for (Violation v : violations) {
            byFile.computeIfAbsent(v.file(), k -> new ArrayList<>()).add(v);
        }
        byFile.forEach((file, fileViolations) -> {
            out.append(file).append('\n');
            for (Violation v : fileViolations) {
                out.append("  Line ").append(v.line()).append('\n')
                   .append("    Type:  ").append(v.type().id()).append('\n')
                   .append("    Issue: ").append(v.description()).append('\n');
                if (!v.snippet().isEmpty()) {
                    out.append("    Code:  ").append(v.snippet()).append('\n');
                }
                if (!v.suggestion().isEmpty()) {
                    out.append("    Fix:   ").append(v.suggestion()).append('\n');
                }
            }
        });
        out.append('\n');
    }
}
