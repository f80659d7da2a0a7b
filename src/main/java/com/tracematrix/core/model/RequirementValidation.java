package com.tracematrix.core.model;

/**
 * Outcome of validating a single requirement's traceability.
 */
public record RequirementValidation(
    Requirement requirement,
    TraceabilityLink link,
    CoverageScore score
) {
    public boolean passed() {
        return score.passed();
    }
}
