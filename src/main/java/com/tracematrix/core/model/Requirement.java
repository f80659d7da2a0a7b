package com.tracematrix.core.model;

import java.util.List;

/**
 * A tracked requirement parsed from the frontmatter of a requirement file.
 * <p>
 * {@code filePath} is relative to the project root and uses forward slashes.
 */
public record Requirement(
    String id,
    String title,
    String epic,
    String status,
    String priority,
    List<String> complianceStandards,
    List<String> dependencies,
    String filePath,
    String lastModified
) {
    public Requirement {
        complianceStandards = complianceStandards == null ? List.of() : List.copyOf(complianceStandards);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
