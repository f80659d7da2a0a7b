package com.tracematrix.core.model;

/**
 * Reference from a requirement back to a feature that lists it.
 */
public record FeatureLink(String name, String domain, String phase) {}
