package com.vidnyan.codeguard.scanner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryScannerTest {

    @TempDir
    Path tempDir;

    private final RepositoryScanner scanner = new RepositoryScanner();

    @Test
    void scanSourceFiles_ShouldFindJavaFilesUnderMavenSourceRoot() throws IOException {
        // Arrange
        Path mainJava = tempDir.resolve("src/main/java/com/example");
        Files.createDirectories(mainJava);
        Files.writeString(mainJava.resolve("Test2.java"), "public class Test2 {}");
        Files.writeString(mainJava.resolve("Test1.java"), "public class Test1 {}");
        Files.writeString(mainJava.resolve("readme.txt"), "documentation");

        // Files outside the source root
        Files.writeString(tempDir.resolve("Root.java"), "public class Root {}");

        // Act
        List<Path> results = scanner.scanSourceFiles(tempDir);

        // Assert
        assertEquals(2, results.size());
        assertTrue(results.get(0).endsWith("Test1.java"));
        assertTrue(results.get(1).endsWith("Test2.java"));
    }

    @Test
    void scanSourceFiles_ShouldIncludeTestRootOnlyWhenAsked() throws IOException {
        // Arrange
        write("src/main/java/App.java");
        write("src/test/java/AppTest.java");

        // Act
        List<Path> withoutTests = scanner.scanSourceFiles(tempDir, false);
        List<Path> withTests = scanner.scanSourceFiles(tempDir, true);

        // Assert
        assertEquals(1, withoutTests.size());
        assertEquals(2, withTests.size());
    }

    @Test
    void scanSourceFiles_ShouldWalkPlainTreesSkippingBuildOutput() throws IOException {
        // Arrange
        write("service/Api.java");
        write("service/target/Generated.java");
        write(".git/hooks/Hook.java");
        write("lib/src/test/LibTest.java");

        // Act
        List<Path> results = scanner.scanSourceFiles(tempDir);

        // Assert
        assertEquals(List.of(tempDir.resolve("service/Api.java")), results);
    }

    private void write(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "class X {}");
    }
}
