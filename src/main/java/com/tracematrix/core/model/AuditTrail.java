package com.tracematrix.core.model;

/**
 * SHA-256 signature over the canonical matrix body, and the moment it was computed.
 */
public record AuditTrail(String signature, String timestamp) {}
