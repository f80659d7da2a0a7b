package com.tracematrix.core.scanner;

import com.tracematrix.testsupport.ProjectFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ArtifactFilesTest {

    private static final List<Pattern> REQ_FILES = List.of(Pattern.compile("^req-.*\\.md$"));

    @TempDir
    Path root;

    @Nested
    @DisplayName("find")
    class Find {

        @Test
        @DisplayName("returns matching files sorted by path, skipping ignored directories")
        void sortedAndFiltered() throws IOException {
            new ProjectFixture(root)
                    .file("b/req-002.md", "")
                    .file("a/req-001.md", "")
                    .file("a/notes.md", "")
                    .file("node_modules/req-003.md", "")
                    .file("a/target/req-004.md", "");

            List<Path> found = ArtifactFiles.find(root, REQ_FILES);

            assertEquals(List.of(root.resolve("a/req-001.md"), root.resolve("b/req-002.md")), found);
        }

        @Test
        @DisplayName("an unreadable subdirectory is skipped and the rest is still found")
        void unreadableSubdirectory() throws IOException {
            assumeFalse("root".equals(System.getProperty("user.name")), "permissions are not enforced for root");
            new ProjectFixture(root)
                    .file("open/req-001.md", "")
                    .file("locked/req-002.md", "");
            Path locked = root.resolve("locked");
            assumeTrue(Files.getFileStore(locked).supportsFileAttributeView("posix"));
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
            try {
                List<Path> found = ArtifactFiles.find(root, REQ_FILES);

                assertEquals(List.of(root.resolve("open/req-001.md")), found);
            } finally {
                Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
            }
        }

        @Test
        @DisplayName("failure to visit an entry below the root continues the walk")
        void failedEntryContinues() throws IOException {
            var collector = new ArtifactFiles.MatchingFileCollector(root, REQ_FILES);
            Path child = root.resolve("locked");

            assertEquals(FileVisitResult.CONTINUE,
                    collector.visitFileFailed(child, new AccessDeniedException(child.toString())));
            assertEquals(FileVisitResult.CONTINUE,
                    collector.postVisitDirectory(child, new AccessDeniedException(child.toString())));
        }

        @Test
        @DisplayName("failure to read the root itself is reported")
        void failedRootThrows() {
            var collector = new ArtifactFiles.MatchingFileCollector(root, REQ_FILES);

            assertThrows(AccessDeniedException.class,
                    () -> collector.visitFileFailed(root, new AccessDeniedException(root.toString())));
        }
    }

    @Test
    @DisplayName("readText replaces malformed UTF-8 instead of failing")
    void readTextIsLenient() throws IOException {
        Path file = root.resolve("req-001.md");
        Files.write(file, new byte[] {'C', 'a', 'f', (byte) 0xE9});

        assertEquals("Caf\uFFFD", ArtifactFiles.readText(file));
    }
}
