package com.tracematrix.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Externalized settings under the {@code tracematrix} prefix.
 * <p>
 * Bound once at startup and converted into an immutable {@link TraceabilityConfig} via
 * {@link #toConfig()}; components never read this class directly.
 */
@Component
@ConfigurationProperties(prefix = "tracematrix")
public class TraceabilityProperties {

    private String projectRoot = ".";
    private Paths paths = new Paths();
    private Scan scan = new Scan();
    private Git git = new Git();
    private Locator locator = new Locator();

    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public Paths getPaths() { return paths; }
    public void setPaths(Paths paths) { this.paths = paths; }
    public Scan getScan() { return scan; }
    public void setScan(Scan scan) { this.scan = scan; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Locator getLocator() { return locator; }
    public void setLocator(Locator locator) { this.locator = locator; }

    /**
     * Resolves every path against the project root and compiles every pattern.
     *
     * @return the immutable configuration handed to the engine components
     * @throws java.util.regex.PatternSyntaxException if a configured pattern is not a valid regex
     */
    public TraceabilityConfig toConfig() {
        Path root = Path.of(projectRoot).toAbsolutePath().normalize();
        return new TraceabilityConfig(
                root,
                root.resolve(paths.requirements),
                paths.tests.stream().map(root::resolve).toList(),
                root.resolve(paths.compliance).resolve(paths.complianceMappingFile),
                root.resolve(paths.features),
                root.resolve(paths.matrixFile),
                root.resolve(paths.exportDir),
                Pattern.compile(scan.requirementFilePattern),
                compileAll(scan.testFilePatterns),
                new LinkedHashSet<>(scan.featureDomains),
                new LinkedHashSet<>(scan.featureSkipDirs),
                git.executable,
                Duration.ofSeconds(git.timeoutSeconds),
                git.enabled,
                compileAll(locator.includePatterns),
                compileAll(locator.excludePatterns)
        );
    }

    private static List<Pattern> compileAll(List<String> regexes) {
        return regexes.stream().map(Pattern::compile).toList();
    }

    public static class Paths {
        private String requirements = "docs/requirements";
        private List<String> tests = new ArrayList<>(List.of("tests", "test", "src/test"));
        private String compliance = "docs/compliance";
        private String complianceMappingFile = "req-to-compliance.json";
        private String features = "docs/features";
        private String matrixFile = ".supernal-coding/traceability-matrix.json";
        private String exportDir = "audit-export";

        public String getRequirements() { return requirements; }
        public void setRequirements(String requirements) { this.requirements = requirements; }
        public List<String> getTests() { return tests; }
        public void setTests(List<String> tests) { this.tests = tests; }
        public String getCompliance() { return compliance; }
        public void setCompliance(String compliance) { this.compliance = compliance; }
        public String getComplianceMappingFile() { return complianceMappingFile; }
        public void setComplianceMappingFile(String complianceMappingFile) { this.complianceMappingFile = complianceMappingFile; }
        public String getFeatures() { return features; }
        public void setFeatures(String features) { this.features = features; }
        public String getMatrixFile() { return matrixFile; }
        public void setMatrixFile(String matrixFile) { this.matrixFile = matrixFile; }
        public String getExportDir() { return exportDir; }
        public void setExportDir(String exportDir) { this.exportDir = exportDir; }
    }

    public static class Scan {
        private String requirementFilePattern = "req-.*\\.md$";
        private List<String> testFilePatterns = new ArrayList<>(List.of(
                "\\.(test|spec)\\.(js|ts|jsx|tsx|mjs|cjs)$",
                "(Test|Tests|IT)\\.java$",
                "^test_.*\\.py$",
                "_test\\.(py|go)$"
        ));
        private List<String> featureDomains = new ArrayList<>(List.of(
                "ai-workflow-system",
                "developer-tooling",
                "compliance-framework",
                "dashboard-platform",
                "workflow-management",
                "content-management",
                "integrations",
                "admin-operations",
                "documentation-platform"
        ));
        private List<String> featureSkipDirs = new ArrayList<>(List.of(
                "planning", "design", "requirements", "tests", "research", "implementation", "archive"
        ));

        public String getRequirementFilePattern() { return requirementFilePattern; }
        public void setRequirementFilePattern(String requirementFilePattern) { this.requirementFilePattern = requirementFilePattern; }
        public List<String> getTestFilePatterns() { return testFilePatterns; }
        public void setTestFilePatterns(List<String> testFilePatterns) { this.testFilePatterns = testFilePatterns; }
        public List<String> getFeatureDomains() { return featureDomains; }
        public void setFeatureDomains(List<String> featureDomains) { this.featureDomains = featureDomains; }
        public List<String> getFeatureSkipDirs() { return featureSkipDirs; }
        public void setFeatureSkipDirs(List<String> featureSkipDirs) { this.featureSkipDirs = featureSkipDirs; }
    }

    public static class Git {
        private String executable = "git";
        private int timeoutSeconds = 30;
        private boolean enabled = true;

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Locator {
        private List<String> includePatterns = new ArrayList<>(List.of(
                "^src/",
                "^lib/",
                "\\.(java|kt|js|jsx|ts|tsx|py|go|rs)$"
        ));
        private List<String> excludePatterns = new ArrayList<>(List.of(
                "(^|/)tests?/",
                "\\.test\\.",
                "\\.spec\\.",
                "(^|/)docs?/",
                "(^|/)documentation/",
                "README",
                "\\.md$"
        ));

        public List<String> getIncludePatterns() { return includePatterns; }
        public void setIncludePatterns(List<String> includePatterns) { this.includePatterns = includePatterns; }
        public List<String> getExcludePatterns() { return excludePatterns; }
        public void setExcludePatterns(List<String> excludePatterns) { this.excludePatterns = excludePatterns; }
    }
}
