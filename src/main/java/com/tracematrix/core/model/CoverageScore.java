package com.tracematrix.core.model;

import java.util.List;

/**
 * Per-requirement coverage: four checks worth 25% each, plus the list of failed checks.
 */
public record CoverageScore(int percentage, List<String> gaps, boolean passed) {
    public CoverageScore {
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }
}
