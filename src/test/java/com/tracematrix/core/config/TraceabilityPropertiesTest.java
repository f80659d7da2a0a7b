package com.tracematrix.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

class TraceabilityPropertiesTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("defaults resolve against the project root")
    void defaults() {
        TraceabilityConfig config = TraceabilityConfig.forProject(root);
        Path base = root.toAbsolutePath().normalize();

        assertEquals(base, config.projectRoot());
        assertEquals(base.resolve("docs/requirements"), config.requirementsDir());
        assertEquals(List.of(base.resolve("tests"), base.resolve("test"), base.resolve("src/test")), config.testDirs());
        assertEquals(base.resolve("docs/compliance/req-to-compliance.json"), config.complianceMappingFile());
        assertEquals(base.resolve("docs/features"), config.featuresDir());
        assertEquals(base.resolve(".supernal-coding/traceability-matrix.json"), config.matrixFile());
        assertEquals(base.resolve("audit-export"), config.exportDir());
        assertEquals(Duration.ofSeconds(30), config.gitTimeout());
        assertTrue(config.gitEnabled());
        assertTrue(config.featureDomains().contains("developer-tooling"));
    }

    @Test
    @DisplayName("overrides are applied")
    void overrides() {
        var properties = new TraceabilityProperties();
        properties.setProjectRoot(root.toString());
        properties.getPaths().setRequirements("reqs");
        properties.getPaths().setTests(List.of("e2e"));
        properties.getGit().setTimeoutSeconds(5);

        TraceabilityConfig config = properties.toConfig();

        assertEquals(root.toAbsolutePath().normalize().resolve("reqs"), config.requirementsDir());
        assertEquals(1, config.testDirs().size());
        assertEquals(Duration.ofSeconds(5), config.gitTimeout());
    }

    @Test
    @DisplayName("relativize uses forward slashes relative to the root")
    void relativize() {
        TraceabilityConfig config = TraceabilityConfig.forProject(root);
        assertEquals("docs/requirements/req-001.md", config.relativize(root.resolve("docs/requirements/req-001.md")));
    }

    @Test
    @DisplayName("invalid pattern fails fast")
    void invalidPattern() {
        var properties = new TraceabilityProperties();
        properties.getScan().setRequirementFilePattern("req-(");
        assertThrows(PatternSyntaxException.class, properties::toConfig);
    }
}
