package com.tracematrix.core.model;

import java.util.List;

/**
 * Clause coverage for one compliance framework, as supplied by the external mapping artifact.
 */
public record ComplianceFrameworkCoverage(
    String frameworkName,
    int totalClauses,
    int coveredClauses,
    int percentage,
    List<String> clauses
) {
    public ComplianceFrameworkCoverage {
        clauses = clauses == null ? List.of() : List.copyOf(clauses);
    }
}
