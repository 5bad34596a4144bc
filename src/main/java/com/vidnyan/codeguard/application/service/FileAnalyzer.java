package com.vidnyan.codeguard.application.service;

import com.vidnyan.codeguard.application.port.out.SyntaxTreeProvider;
import com.vidnyan.codeguard.domain.context.ContextWindow;
import com.vidnyan.codeguard.domain.detector.DetectionContext;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.model.AnalysisNote;
import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import com.vidnyan.codeguard.domain.syntax.ParseResult;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses one file and runs every detector over it.
 * Stateless: called concurrently by the worker pool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileAnalyzer {

    private final SyntaxTreeProvider syntaxTreeProvider;
    private final List<ViolationDetector> detectors;

    /**
     * Result for one file: either its violations or the note explaining why it was skipped.
     */
    public record FileAnalysis(String path, List<Violation> violations, AnalysisNote note) {

        public boolean isSkipped() {
            return note != null;
        }
    }

    public FileAnalysis analyze(Path file, Path root, PatternLibrary patterns, ContextWindow window) {
        ParseResult parsed = syntaxTreeProvider.parse(file, root);
        if (!parsed.isSuccess()) {
            AnalysisNote note = AnalysisNote.of(parsed.error(), root);
            log.warn("Skipping {}: {}", note.file(), note.message());
            return new FileAnalysis(note.file(), List.of(), note);
        }
        SyntaxTree tree = parsed.tree();
        DetectionContext context = DetectionContext.of(tree, window, patterns);

        List<Violation> violations = new ArrayList<>();
        for (ViolationDetector detector : detectors) {
            try {
                List<Violation> found = detector.detect(context);
                for (Violation v : found) {
                    if (tree.containsLine(v.line())) {
                        violations.add(v);
                    } else {
                        log.debug("Dropping {} finding outside {} at line {}", v.type().id(), tree.path(), v.line());
                    }
                }
            } catch (RuntimeException e) {
                log.error("Error running {} on {}: {}", detector.getName(), tree.path(), e.getMessage(), e);
            }
        }
        log.debug("{}: {} violations", tree.path(), violations.size());
        return new FileAnalysis(tree.path(), violations, null);
    }

    public int detectorCount() {
        return detectors.size();
    }
}
