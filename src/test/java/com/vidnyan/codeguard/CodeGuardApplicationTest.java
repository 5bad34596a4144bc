package com.vidnyan.codeguard;

import com.vidnyan.codeguard.application.port.in.AnalyzeCodeUseCase;
import com.vidnyan.codeguard.application.port.in.AnalyzeCodeUseCase.AnalysisRequest;
import com.vidnyan.codeguard.application.port.in.AnalyzeCodeUseCase.AnalysisResult;
import com.vidnyan.codeguard.application.port.out.ReportRenderer;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CodeGuardApplicationTest {

    @Autowired
    private AnalyzeCodeUseCase analyzeCodeUseCase;

    @Autowired
    private List<ViolationDetector> detectors;

    @Autowired
    private List<ReportRenderer> renderers;

    @Autowired
    private PatternLibrary patternLibrary;

    @TempDir
    Path tempDir;

    @Test
    void contextLoads_WithAllDetectorsAndRenderers() {
        assertEquals(11, detectors.size());
        assertEquals(2, renderers.size());
        assertEquals("classpath:patterns/default-patterns.yml", patternLibrary.source());
    }

    @Test
    void analyze_ShouldRunWiredPipeline() throws IOException {
        // Arrange
        Path source = tempDir.resolve("src/main/java/shop/UserDao.java");
        Files.createDirectories(source.getParent());
        Files.writeString(source, """
                package shop;

                class UserDao {
                    User find(String id) {
                        return jdbc.queryForObject("SELECT * FROM users WHERE id = " + id, mapper);
                    }
                }
                """);

        // Act
        AnalysisResult result = analyzeCodeUseCase.analyze(AnalysisRequest.forPath(tempDir));

        // Assert
        assertTrue(result.report().getViolations().stream()
                .anyMatch(v -> v.type() == ViolationType.SQL_INJECTION));
        assertTrue(result.report().getViolations().stream()
                .anyMatch(v -> v.type() == ViolationType.ERROR_HANDLING_MISSING));
        assertEquals(1, result.exitCode());
    }
}
