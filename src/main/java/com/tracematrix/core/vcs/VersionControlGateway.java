package com.tracematrix.core.vcs;

import com.tracematrix.core.model.CommitRecord;

import java.util.List;

/**
 * Read-only queries against the project's version-control history.
 * <p>
 * Implementations never throw for tool failures: an unavailable binary, a non-zero exit
 * or a timeout all mean "no data" and yield an empty list.
 */
public interface VersionControlGateway {

    /**
     * Local and remote branch names, with the current-branch marker removed.
     * Remote branches keep their {@code remotes/<remote>/} prefix.
     */
    List<String> listBranches();

    /**
     * Commits whose message contains {@code requirementId}, each with the paths it touched.
     */
    List<CommitRecord> findCommitsReferencing(String requirementId);
}
