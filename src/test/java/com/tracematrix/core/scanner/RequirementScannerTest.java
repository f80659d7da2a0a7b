package com.tracematrix.core.scanner;

import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.frontmatter.FrontmatterParser;
import com.tracematrix.core.model.Requirement;
import com.tracematrix.testsupport.ProjectFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequirementScannerTest {

    @TempDir
    Path root;

    private RequirementScanner scanner() {
        return new RequirementScanner(TraceabilityConfig.forProject(root), new FrontmatterParser());
    }

    @Test
    @DisplayName("reads requirement files recursively, keyed by id")
    void readsRequirements() {
        new ProjectFixture(root)
                .requirement("core/req-001-login.md", "REQ-001", "User login", "ISO13485")
                .requirement("req-002-logout.md", "REQ-002", "User logout");

        var requirements = scanner().scan();

        assertEquals(List.of("REQ-001", "REQ-002"), List.copyOf(requirements.keySet()));
        Requirement login = requirements.get("REQ-001");
        assertEquals("User login", login.title());
        assertEquals("core", login.epic());
        assertEquals("approved", login.status());
        assertEquals(List.of("ISO13485"), login.complianceStandards());
        assertEquals("docs/requirements/core/req-001-login.md", login.filePath());
        assertNotNull(login.lastModified());
    }

    @Test
    @DisplayName("files without frontmatter or without an id are skipped")
    void skipsIncompleteFiles() {
        new ProjectFixture(root)
                .file("docs/requirements/req-003.md", "# No frontmatter\n")
                .file("docs/requirements/req-004.md", "---\ntitle: Missing id\n---\n")
                .requirement("req-005.md", "REQ-005", "Valid");

        assertEquals(List.of("REQ-005"), List.copyOf(scanner().scan().keySet()));
    }

    @Test
    @DisplayName("files not matching req-*.md are ignored")
    void ignoresOtherFiles() {
        new ProjectFixture(root)
                .file("docs/requirements/README.md", "---\nid: REQ-099\n---\n")
                .file("docs/requirements/req-006.txt", "---\nid: REQ-006\n---\n");

        assertTrue(scanner().scan().isEmpty());
    }

    @Test
    @DisplayName("missing title defaults to Untitled")
    void defaultTitle() {
        new ProjectFixture(root).file("docs/requirements/req-007.md", "---\nid: REQ-007\n---\n");

        assertEquals("Untitled", scanner().scan().get("REQ-007").title());
    }

    @Test
    @DisplayName("duplicate ids keep the first file in path order")
    void duplicateIds() {
        new ProjectFixture(root)
                .requirement("a/req-008.md", "REQ-008", "First")
                .requirement("b/req-008.md", "REQ-008", "Second");

        assertEquals("First", scanner().scan().get("REQ-008").title());
    }

    @Test
    @DisplayName("malformed YAML is read leniently instead of dropped")
    void lenientFrontmatter() {
        new ProjectFixture(root).file("docs/requirements/req-009.md",
                "---\nid: REQ-009\ntitle: Audit: export\n---\n");

        assertEquals("Audit: export", scanner().scan().get("REQ-009").title());
    }

    @Test
    @DisplayName("a Latin-1 encoded file is still read")
    void latin1File() {
        new ProjectFixture(root).file("docs/requirements/req-010.md",
                "---\nid: REQ-010\ntitle: Café export\n---\n", StandardCharsets.ISO_8859_1);

        Requirement requirement = scanner().scan().get("REQ-010");

        assertNotNull(requirement);
        assertTrue(requirement.title().startsWith("Caf"));
        assertTrue(requirement.title().endsWith(" export"));
    }

    @Test
    @DisplayName("missing requirements directory yields an empty map")
    void missingDirectory() {
        assertTrue(scanner().scan().isEmpty());
    }
}
