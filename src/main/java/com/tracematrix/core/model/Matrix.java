package com.tracematrix.core.model;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The traceability matrix: every scanned artifact, the derived links, coverage, and
 * the audit trail. All maps are key-sorted so serialization order is stable.
 * <p>
 * A matrix is never modified after it is built; {@link #withAuditTrail} returns a copy.
 */
public record Matrix(
    MatrixMetadata metadata,
    SortedMap<String, Requirement> requirements,
    SortedMap<String, TestRecord> tests,
    SortedMap<String, List<String>> gitBranches,
    SortedMap<String, ComplianceFrameworkCoverage> complianceFrameworks,
    SortedMap<String, FeatureRecord> features,
    SortedMap<String, TraceabilityLink> traceabilityLinks,
    CoverageSummary coverage,
    AuditTrail auditTrail
) {
    public Matrix {
        requirements = requirements == null ? new TreeMap<>() : new TreeMap<>(requirements);
        tests = tests == null ? new TreeMap<>() : new TreeMap<>(tests);
        gitBranches = gitBranches == null ? new TreeMap<>() : new TreeMap<>(gitBranches);
        complianceFrameworks = complianceFrameworks == null ? new TreeMap<>() : new TreeMap<>(complianceFrameworks);
        features = features == null ? new TreeMap<>() : new TreeMap<>(features);
        traceabilityLinks = traceabilityLinks == null ? new TreeMap<>() : new TreeMap<>(traceabilityLinks);
        for (String id : traceabilityLinks.keySet()) {
            if (!requirements.containsKey(id)) {
                throw new IllegalArgumentException("Traceability link for unknown requirement: " + id);
            }
        }
    }

    public static Matrix unsigned(MatrixMetadata metadata, ScanResult scan,
                                  SortedMap<String, TraceabilityLink> links, CoverageSummary coverage) {
        return new Matrix(metadata, scan.requirements(), scan.tests(), scan.gitBranches(),
                scan.complianceFrameworks(), scan.features(), links, coverage, null);
    }

    public Matrix withAuditTrail(AuditTrail trail) {
        return new Matrix(metadata, requirements, tests, gitBranches, complianceFrameworks,
                features, traceabilityLinks, coverage, trail);
    }

    public TraceabilityLink linkFor(String requirementId) {
        return traceabilityLinks.getOrDefault(requirementId, TraceabilityLink.empty());
    }

    public int branchCount() {
        return gitBranches.values().stream().mapToInt(List::size).sum();
    }
}
