package com.vidnyan.codeguard.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codeguard.adapter.out.component.FileSystemComponentRepository;
import com.vidnyan.codeguard.adapter.out.detector.defensive.BoundsSafetyDetector;
import com.vidnyan.codeguard.adapter.out.detector.defensive.NullSafetyDetector;
import com.vidnyan.codeguard.adapter.out.parser.JavaParserSyntaxTreeProvider;
import com.vidnyan.codeguard.adapter.out.report.JsonReportRenderer;
import com.vidnyan.codeguard.application.port.in.AnalyzeCodeUseCase.AnalysisRequest;
import com.vidnyan.codeguard.application.port.in.AnalyzeCodeUseCase.AnalysisResult;
import com.vidnyan.codeguard.application.port.in.CancellationToken;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.exception.CodeGuardException;
import com.vidnyan.codeguard.domain.model.AnalysisNote;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import com.vidnyan.codeguard.domain.report.AnalysisReport;
import com.vidnyan.codeguard.scanner.RepositoryScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisApplicationServiceTest {

    @TempDir
    Path tempDir;

    private AnalysisApplicationService service;

    @BeforeEach
    void setUp() throws IOException {
        JavaParserSyntaxTreeProvider provider = new JavaParserSyntaxTreeProvider();
        RepositoryScanner scanner = new RepositoryScanner();
        List<ViolationDetector> detectors = List.of(new NullSafetyDetector(), new BoundsSafetyDetector(),
                failingDetector());
        service = new AnalysisApplicationService(
                scanner,
                new FileAnalyzer(provider, detectors),
                new DependencyGraphAnalyzer(new FileSystemComponentRepository(new ObjectMapper(), scanner), provider),
                PatternLibrary.builtInDefaults());

        Files.writeString(tempDir.resolve("Good.java"), """
                class Good {
                    String name(User user) {
                        if (user == null) {
                            return "";
                        }
                        return user.getName();
                    }
                    int ratio(int a, int b) {
                        return a / b;
                    }
                }
                """);
        Files.writeString(tempDir.resolve("Broken.java"), "class Broken { void x( }");
    }

    @Test
    void analyze_ShouldSkipUnparsableFileAndAnalyzeTheRest() {
        // Act
        AnalysisResult result = service.analyze(request(4, null));

        // Assert
        AnalysisReport report = result.report();
        assertEquals(1, report.getSummary().getFilesAnalyzed());
        assertEquals(1, report.getSummary().getFilesSkipped());
        assertEquals(1, report.getNotes().size());
        AnalysisNote note = report.getNotes().get(0);
        assertEquals("Broken.java", note.file());
        assertEquals(AnalysisNote.Kind.PARSE_ERROR, note.kind());

        assertEquals(1, report.getViolations().size());
        assertEquals(ViolationType.BOUNDS_SAFETY, report.getViolations().get(0).type());
        assertEquals("Good.java", report.getViolations().get(0).file());
        assertEquals(2, result.stats().filesScanned());
        assertFalse(result.cancelled());
        assertEquals(0, result.exitCode());
    }

    @Test
    void analyze_ShouldProduceIdenticalReportsRegardlessOfWorkerCount() {
        // Arrange
        JsonReportRenderer renderer = new JsonReportRenderer(new ObjectMapper());

        // Act
        String sequential = renderer.render(service.analyze(request(1, null)).report());
        String parallel = renderer.render(service.analyze(request(4, null)).report());

        // Assert
        assertEquals(sequential, parallel);
    }

    @Test
    void analyze_ShouldApplyLookbackOverride() {
        // Act
        AnalysisResult result = service.analyze(request(2, 0));

        // Assert
        assertEquals(2, result.report().getViolations().size());
        assertEquals(ViolationType.NULL_SAFETY, result.report().getViolations().get(0).type());
        assertEquals(1, result.exitCode());
    }

    @Test
    void analyze_ShouldReportNothingWhenCancelledUpFront() {
        // Arrange
        CancellationToken token = CancellationToken.create();
        token.cancel();

        // Act
        AnalysisResult result = service.analyze(request(2, null), token);

        // Assert
        assertTrue(result.cancelled());
        assertEquals(0, result.report().getSummary().getFilesAnalyzed());
        assertTrue(result.report().getViolations().isEmpty());
    }

    @Test
    void analyze_ShouldRejectMissingRepository() {
        assertThrows(CodeGuardException.class,
                () -> service.analyze(AnalysisRequest.forPath(tempDir.resolve("missing"))));
    }

    private AnalysisRequest request(int workers, Integer lookback) {
        return new AnalysisRequest(tempDir, false, lookback, workers, "components", "contracts");
    }

    // A detector that always fails must not stop the others.
    private static ViolationDetector failingDetector() {
        return context -> {
            throw new IllegalStateException("boom");
        };
    }
}
