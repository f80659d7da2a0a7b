package com.tracematrix.core.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * File-walking helpers shared by the artifact scanners.
 * <p>
 * Build-tool and IDE directories (e.g. {@code .git}, {@code node_modules}, {@code target})
 * are never descended into. Entries that cannot be read are logged and skipped.
 */
final class ArtifactFiles {

    private static final Logger log = LoggerFactory.getLogger(ArtifactFiles.class);

    /** Directories to skip during the walk. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".next"
    );

    private ArtifactFiles() {}

    /**
     * Recursively lists regular files under {@code dir} whose file name contains a match
     * for any of {@code namePatterns}, sorted by path.
     *
     * @throws IOException if {@code dir} itself cannot be walked
     */
    static List<Path> find(Path dir, List<Pattern> namePatterns) throws IOException {
        var collector = new MatchingFileCollector(dir, namePatterns);
        Files.walkFileTree(dir, collector);
        return collector.matches();
    }

    /**
     * Reads a file as UTF-8. Malformed bytes become U+FFFD instead of failing the read.
     */
    static String readText(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    static String lastModified(Path file) throws IOException {
        FileTime time = Files.getLastModifiedTime(file);
        return time.toInstant().toString();
    }

    private static boolean matchesAny(String name, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }

    /** Collects matching files; unreadable directories and files are skipped with a WARN. */
    static final class MatchingFileCollector extends SimpleFileVisitor<Path> {

        private final Path root;
        private final List<Pattern> namePatterns;
        private final List<Path> matches = new ArrayList<>();

        MatchingFileCollector(Path root, List<Pattern> namePatterns) {
            this.root = root;
            this.namePatterns = namePatterns;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(root) && IGNORE_DIRS.contains(dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (Files.isRegularFile(file) && matchesAny(file.getFileName().toString(), namePatterns)) {
                matches.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
            if (file.equals(root)) {
                throw e;
            }
            log.warn("Skipping unreadable path {}: {}", file, e.toString());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException e) {
            if (e != null) {
                log.warn("Directory {} was only partly read: {}", dir, e.toString());
            }
            return FileVisitResult.CONTINUE;
        }

        List<Path> matches() {
            var sorted = new ArrayList<>(matches);
            Collections.sort(sorted);
            return sorted;
        }
    }
}
