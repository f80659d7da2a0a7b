package com.tracematrix.core.model;

/**
 * Provenance of a generated matrix.
 */
public record MatrixMetadata(String generatedAt, String generatedBy, String generatorVersion) {}
