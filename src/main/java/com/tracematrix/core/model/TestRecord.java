package com.tracematrix.core.model;

import java.util.List;

/**
 * A test file together with the requirement IDs it references.
 */
public record TestRecord(
    String filePath,
    List<String> requirementRefs,
    String lastModified
) {
    public TestRecord {
        requirementRefs = requirementRefs == null ? List.of() : List.copyOf(requirementRefs);
    }

    public boolean references(String requirementId) {
        return requirementRefs.contains(requirementId);
    }
}
