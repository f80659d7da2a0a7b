package com.tracematrix.core.model;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Aggregate coverage at requirement, feature and compliance-framework granularity.
 */
public record CoverageSummary(
    RequirementTotals requirements,
    FeatureTotals features,
    SortedMap<String, FrameworkTotals> complianceFrameworks
) {
    public CoverageSummary {
        complianceFrameworks = complianceFrameworks == null
                ? new TreeMap<>()
                : new TreeMap<>(complianceFrameworks);
    }

    public record RequirementTotals(int total, int tested, int percentage) {}

    public record FeatureTotals(
        int total,
        int withRequirements,
        int withTests,
        int requirementsPercentage,
        int testsPercentage
    ) {}

    public record FrameworkTotals(int totalClauses, int coveredClauses, int percentage) {}
}
