package com.tracematrix.core.model;

/**
 * A branch name attributed to a normalized requirement ID.
 */
public record GitBranchRef(String requirementId, String branchName) {}
