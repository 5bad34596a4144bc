package com.vidnyan.codeguard.scanner;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Scans a repository for Java source files.
 * <p>
 * A Maven-style tree is scanned through its source roots ({@code src/main/java},
 * plus {@code src/test/java} when tests are included). Any other tree is walked
 * whole, skipping build output and VCS directories. Results are sorted.
 */
@Component
public class RepositoryScanner {

    private static final Set<String> SKIPPED_DIRECTORIES =
            Set.of("target", "build", ".git", "node_modules", "out", ".idea", ".gradle");

    public List<Path> scanSourceFiles(Path root) throws IOException {
        return scanSourceFiles(root, false);
    }

    /**
     * Scan and return all Java source files below the root.
     */
    public List<Path> scanSourceFiles(Path root, boolean includeTests) throws IOException {
        List<Path> sourceFiles = new ArrayList<>();
        for (Path sourceRoot : sourceRoots(root, includeTests)) {
            try (Stream<Path> paths = Files.walk(sourceRoot)) {
                paths.filter(Files::isRegularFile)
                     .filter(p -> p.toString().endsWith(".java"))
                     .filter(p -> !isSkipped(sourceRoot.relativize(p), includeTests))
                     .forEach(sourceFiles::add);
            }
        }
        sourceFiles.sort(null);
        return sourceFiles;
    }

    /**
     * Discover source roots (src/main/java, src/test/java), or the root itself.
     */
    List<Path> sourceRoots(Path root, boolean includeTests) {
        List<Path> roots = new ArrayList<>();
        Path mainJava = root.resolve("src/main/java");
        Path testJava = root.resolve("src/test/java");

        if (Files.isDirectory(mainJava)) {
            roots.add(mainJava);
            if (includeTests && Files.isDirectory(testJava)) {
                roots.add(testJava);
            }
        } else if (Files.isDirectory(root)) {
            roots.add(root);
        }
        return roots;
    }

    private boolean isSkipped(Path relative, boolean includeTests) {
        Path parent = relative.getParent();
        if (parent == null) {
            return false;
        }
        for (int i = 0; i < parent.getNameCount(); i++) {
            String segment = parent.getName(i).toString();
            if (SKIPPED_DIRECTORIES.contains(segment)) {
                return true;
            }
            if (!includeTests && segment.equals("src") && i + 1 < parent.getNameCount()
                    && parent.getName(i + 1).toString().equals("test")) {
                return true;
            }
        }
        return false;
    }
}
