package com.pitlane.timing.domain.model;

/**
 * Closed set of failure categories reported by the cache tiers.
 */
public enum ErrorKind {
    /** Backing service unreachable or timed out. */
    CONNECTIVITY,
    /** Payload could not be encoded or decoded. */
    SERIALIZATION,
    NOT_FOUND,
    INTERNAL
}
