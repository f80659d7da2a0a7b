package com.tracematrix.core.model;

import java.util.List;

/**
 * A commit returned by a version-control log query, with the paths it touched.
 */
public record CommitRecord(String hash, String subject, List<String> files) {
    public CommitRecord {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
