package com.vidnyan.codeguard.adapter.out.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codeguard.application.port.out.ReportRenderer;
import com.vidnyan.codeguard.domain.exception.CodeGuardException;
import com.vidnyan.codeguard.domain.model.AnalysisNote;
import com.vidnyan.codeguard.domain.model.PredictedFailure;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.report.AnalysisReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Machine-readable report. Carries no timestamps or durations, so identical
 * inputs produce byte-identical output.
 */
@Component
@RequiredArgsConstructor
public class JsonReportRenderer implements ReportRenderer {

    private final ObjectMapper objectMapper;

    @Override
    public String format() {
        return "json";
    }

    @Override
    public String render(AnalysisReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDto(report)) + "\n";
        } catch (JsonProcessingException e) {
            throw new CodeGuardException("Failed to render JSON report", e);
        }
    }

    ReportDto toDto(AnalysisReport report) {
        AnalysisReport.Summary s = report.getSummary();
        ReportDto dto = new ReportDto();
        dto.summary = new SummaryDto(s.getTotal(), s.getCritical(), s.getWarning(), s.getInfo(),
                new TreeMap<>(s.getByType()), s.getFilesAnalyzed(), s.getFilesSkipped());
        dto.violations = report.getViolations().stream().map(this::toDto).toList();
        dto.predictedFailures = report.getPredictedFailures().stream().map(this::toDto).toList();
        dto.notes = report.getNotes().stream().map(this::toDto).toList();
        return dto;
    }

    private ViolationDto toDto(Violation v) {
        return new ViolationDto(v.file(), v.line(), v.type().id(), v.severity().id(),
                v.description(), v.snippet(), v.suggestion());
    }

    private FailureDto toDto(PredictedFailure f) {
        return new FailureDto(f.type().id(), f.componentA(), f.componentB(), f.severity().id(),
                f.description(), f.fixStrategy(), f.testGeneration());
    }

    private NoteDto toDto(AnalysisNote n) {
        return new NoteDto(n.file(), n.kind().name().toLowerCase(Locale.ROOT), n.message());
    }

    // DTO classes for JSON serialization
    @JsonPropertyOrder({"summary", "violations", "predicted_failures", "notes"})
    static class ReportDto {
        public SummaryDto summary;
        public List<ViolationDto> violations;
        @JsonProperty("predicted_failures")
        public List<FailureDto> predictedFailures;
        public List<NoteDto> notes;
    }

    @JsonPropertyOrder({"total", "critical", "warning", "info", "by_type", "files_analyzed", "files_skipped"})
    record SummaryDto(
        int total,
        int critical,
        int warning,
        int info,
        @JsonProperty("by_type") Map<String, Integer> byType,
        @JsonProperty("files_analyzed") int filesAnalyzed,
        @JsonProperty("files_skipped") int filesSkipped
    ) {}

    @JsonPropertyOrder({"file", "line", "type", "severity", "description", "snippet", "suggestion"})
    record ViolationDto(
        String file,
        int line,
        String type,
        String severity,
        String description,
        String snippet,
        String suggestion
    ) {}

    @JsonPropertyOrder({"type", "component_a", "component_b", "severity", "description", "suggestion",
            "test_generation"})
    record FailureDto(
        String type,
        @JsonProperty("component_a") String componentA,
        @JsonProperty("component_b") String componentB,
        String severity,
        String description,
        String suggestion,
        @JsonProperty("test_generation") String testGeneration
    ) {}

    @JsonPropertyOrder({"file", "kind", "message"})
    record NoteDto(String file, String kind, String message) {}
}
