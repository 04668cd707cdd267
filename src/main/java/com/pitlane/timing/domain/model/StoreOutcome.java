package com.pitlane.timing.domain.model;

/**
 * Result of a mutating tier operation: a success flag plus, on failure, what went wrong.
 */
public record StoreOutcome(boolean success, ErrorKind errorKind, String detail) {

    private static final StoreOutcome OK = new StoreOutcome(true, null, null);

    public static StoreOutcome ok() {
        return OK;
    }

    public static StoreOutcome failure(ErrorKind errorKind, String detail) {
        return new StoreOutcome(false, errorKind, detail);
    }

    public boolean failed() {
        return !success;
    }
}
