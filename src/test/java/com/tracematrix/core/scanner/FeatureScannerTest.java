package com.tracematrix.core.scanner;

import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.frontmatter.FrontmatterParser;
import com.tracematrix.core.model.FeatureRecord;
import com.tracematrix.testsupport.ProjectFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureScannerTest {

    @TempDir
    Path root;

    private FeatureScanner scanner() {
        return new FeatureScanner(TraceabilityConfig.forProject(root), new FrontmatterParser());
    }

    @Test
    @DisplayName("reads feature READMEs in known domains")
    void readsFeatures() {
        new ProjectFixture(root).feature("developer-tooling", "traceability-matrix", "implementing", "REQ-010", "044");

        FeatureRecord feature = scanner().scan().get("traceability-matrix");

        assertNotNull(feature);
        assertEquals("developer-tooling", feature.domain());
        assertEquals("docs/features/developer-tooling/traceability-matrix", feature.path());
        assertEquals("implementing", feature.phase());
        assertEquals(List.of("REQ-010", "044"), feature.requirements());
        assertEquals("medium", feature.priority());
        assertFalse(feature.testsPending());
    }

    @Test
    @DisplayName("unknown domains, skip directories and folders without README are ignored")
    void ignoresOtherDirectories() {
        new ProjectFixture(root)
                .feature("random-domain", "orphan", "planning")
                .feature("integrations", "planning", "planning")
                .file("docs/features/integrations/no-readme/notes.md", "notes");

        assertTrue(scanner().scan().isEmpty());
    }

    @Test
    @DisplayName("README without frontmatter falls back to defaults")
    void defaults() {
        new ProjectFixture(root).file("docs/features/integrations/webhooks/README.md", "# Webhooks\n");

        FeatureRecord feature = scanner().scan().get("webhooks");

        assertEquals("webhooks", feature.title());
        assertEquals("unknown", feature.phase());
        assertEquals("", feature.epic());
        assertTrue(feature.requirements().isEmpty());
    }

    @Test
    @DisplayName("status is used when phase is absent, tests_pending is read")
    void statusAndPending() {
        new ProjectFixture(root).file("docs/features/integrations/sso/README.md",
                "---\nstatus: done\ntests_pending: true\n---\n");

        FeatureRecord feature = scanner().scan().get("sso");

        assertEquals("done", feature.phase());
        assertTrue(feature.testsPending());
    }

    @Test
    @DisplayName("a Latin-1 encoded README keeps its requirements")
    void latin1Readme() {
        new ProjectFixture(root).file("docs/features/developer-tooling/export/README.md",
                "---\ntitle: Résumé export\nphase: done\nrequirements:\n  - REQ-010\n---\n",
                StandardCharsets.ISO_8859_1);

        FeatureRecord feature = scanner().scan().get("export");

        assertEquals("done", feature.phase());
        assertEquals(List.of("REQ-010"), feature.requirements());
    }
}
