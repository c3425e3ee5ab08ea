package com.synthgov.core;

/**
 * Thrown at the entry point when the caller hands over something that is not a
 * metric mapping (or asks for an output mode that does not exist).
 * Missing or invalid metric values never cause this; they become uncertainty notes.
 */
public class GovernanceContractException extends IllegalArgumentException {

    public GovernanceContractException(String message) {
        super(message);
    }

    public GovernanceContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
