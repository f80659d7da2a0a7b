package com.tracematrix.core.model;

import java.util.List;

/**
 * A feature descriptor read from {@code <domain>/<feature>/README.md}.
 */
public record FeatureRecord(
    String name,
    String domain,
    String path,
    String title,
    String phase,
    List<String> requirements,
    String epic,
    String priority,
    boolean testsPending
) {
    public FeatureRecord {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }
}
