package com.tracematrix.core.model;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Combined output of all artifact scanners. Link building starts only once this is complete.
 */
public record ScanResult(
    SortedMap<String, Requirement> requirements,
    SortedMap<String, TestRecord> tests,
    SortedMap<String, List<String>> gitBranches,
    SortedMap<String, ComplianceFrameworkCoverage> complianceFrameworks,
    SortedMap<String, FeatureRecord> features
) {
    public ScanResult {
        requirements = requirements == null ? new TreeMap<>() : new TreeMap<>(requirements);
        tests = tests == null ? new TreeMap<>() : new TreeMap<>(tests);
        gitBranches = gitBranches == null ? new TreeMap<>() : new TreeMap<>(gitBranches);
        complianceFrameworks = complianceFrameworks == null ? new TreeMap<>() : new TreeMap<>(complianceFrameworks);
        features = features == null ? new TreeMap<>() : new TreeMap<>(features);
    }
}
