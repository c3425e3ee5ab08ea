package com.synthgov.core.sanitize;

/**
 * A data-quality problem found while sanitizing. Never fatal.
 */
public record SanitizationIssue(String path, Reason reason, String detail) {

    public enum Reason {
        NON_FINITE,
        NULL_VALUE,
        TYPE_MISMATCH
    }

    /** Note text as it appears in {@code uncertainty_notes}. */
    public String describe() {
        return switch (reason) {
            case NON_FINITE -> "metric " + path + " was non-finite (" + detail + "), value discarded";
            case NULL_VALUE -> "metric " + path + " was null, treated as missing";
            case TYPE_MISMATCH -> "metric " + path + " " + detail + ", treated as missing";
        };
    }
}
