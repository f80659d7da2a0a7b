package com.tracematrix.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolved, immutable configuration passed to every engine component.
 * All paths are absolute.
 */
public record TraceabilityConfig(
    Path projectRoot,
    Path requirementsDir,
    List<Path> testDirs,
    Path complianceMappingFile,
    Path featuresDir,
    Path matrixFile,
    Path exportDir,
    Pattern requirementFilePattern,
    List<Pattern> testFilePatterns,
    Set<String> featureDomains,
    Set<String> featureSkipDirs,
    String gitExecutable,
    Duration gitTimeout,
    boolean gitEnabled,
    List<Pattern> implementationIncludes,
    List<Pattern> implementationExcludes
) {
    public TraceabilityConfig {
        testDirs = List.copyOf(testDirs);
        testFilePatterns = List.copyOf(testFilePatterns);
        featureDomains = Set.copyOf(featureDomains);
        featureSkipDirs = Set.copyOf(featureSkipDirs);
        implementationIncludes = List.copyOf(implementationIncludes);
        implementationExcludes = List.copyOf(implementationExcludes);
    }

    /** Default configuration rooted at {@code projectRoot}. */
    public static TraceabilityConfig forProject(Path projectRoot) {
        var properties = new TraceabilityProperties();
        properties.setProjectRoot(projectRoot.toString());
        return properties.toConfig();
    }

    /** Path relative to the project root with forward slashes, as stored in the matrix. */
    public String relativize(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!absolute.startsWith(projectRoot)) {
            return absolute.toString().replace('\\', '/');
        }
        return projectRoot.relativize(absolute).toString().replace('\\', '/');
    }
}
