package com.tracematrix.core.model;

import java.util.List;

/**
 * A compliance framework attached to a requirement through its {@code complianceStandards}.
 */
public record ComplianceLink(
    String framework,
    List<String> clauses,
    int totalClauses,
    int coveredClauses,
    int percentage
) {
    public ComplianceLink {
        clauses = clauses == null ? List.of() : List.copyOf(clauses);
    }

    public static ComplianceLink of(ComplianceFrameworkCoverage coverage) {
        return new ComplianceLink(coverage.frameworkName(), coverage.clauses(),
                coverage.totalClauses(), coverage.coveredClauses(), coverage.percentage());
    }
}
