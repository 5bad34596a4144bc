package com.vidnyan.codeguard.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.vidnyan.codeguard.application.port.out.SyntaxTreeProvider;
import com.vidnyan.codeguard.domain.syntax.ParseError;
import com.vidnyan.codeguard.domain.syntax.ParseResult;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;
import com.vidnyan.codeguard.domain.syntax.SyntaxTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JavaParser-based implementation of SyntaxTreeProvider.
 * Parses Java source files and converts them into language-neutral syntax trees.
 */
@Slf4j
@Component
public class JavaParserSyntaxTreeProvider implements SyntaxTreeProvider {

    private final ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_21);

    @Override
    public ParseResult parse(Path file, Path root) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", file, e.getMessage());
            return ParseResult.failure(ParseError.io(file, e.getMessage()));
        }
        return parseSource(file, SyntaxTree.displayPath(file, root), source);
    }

    @Override
    public ParseResult parseSource(Path file, String displayPath, String source) {
        // JavaParser instances are not thread-safe, one per file
        JavaParser parser = new JavaParser(configuration);
        com.github.javaparser.ParseResult<CompilationUnit> result = parser.parse(source);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            Problem problem = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
            int line = problem == null ? 0 : problem.getLocation()
                    .flatMap(TokenRange::toRange)
                    .map(range -> range.begin.line)
                    .orElse(0);
            String message = problem == null ? "unknown parse failure" : firstLine(problem.getMessage());
            log.debug("Syntax error in {} at line {}: {}", displayPath, line, message);
            return ParseResult.failure(ParseError.syntax(file, line, message));
        }

        SyntaxNode root = new JavaSyntaxTreeBuilder(displayPath).build(result.getResult().get());
        return ParseResult.success(SyntaxTree.of(file, displayPath, source, root));
    }

    @Override
    public boolean supports(Path file) {
        return file.getFileName() != null && file.getFileName().toString().endsWith(".java");
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
