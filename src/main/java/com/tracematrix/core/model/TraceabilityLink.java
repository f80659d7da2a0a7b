package com.tracematrix.core.model;

import java.util.List;

/**
 * Everything connected to one requirement: tests, branches, implementation files,
 * compliance frameworks and features.
 */
public record TraceabilityLink(
    List<String> tests,
    List<String> branches,
    List<String> implementationFiles,
    List<ComplianceLink> complianceFrameworks,
    List<FeatureLink> features
) {
    public TraceabilityLink {
        tests = tests == null ? List.of() : List.copyOf(tests);
        branches = branches == null ? List.of() : List.copyOf(branches);
        implementationFiles = implementationFiles == null ? List.of() : List.copyOf(implementationFiles);
        complianceFrameworks = complianceFrameworks == null ? List.of() : List.copyOf(complianceFrameworks);
        features = features == null ? List.of() : List.copyOf(features);
    }

    public static TraceabilityLink empty() {
        return new TraceabilityLink(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public boolean hasTests() { return !tests.isEmpty(); }
    public boolean hasBranches() { return !branches.isEmpty(); }
    public boolean hasImplementationFiles() { return !implementationFiles.isEmpty(); }
    public boolean hasComplianceMapping() { return !complianceFrameworks.isEmpty(); }
}
