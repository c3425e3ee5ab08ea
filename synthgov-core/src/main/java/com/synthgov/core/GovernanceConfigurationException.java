package com.synthgov.core;

/**
 * Raised while building the engine from a malformed configuration.
 * Always happens before the first evaluation.
 */
public class GovernanceConfigurationException extends IllegalStateException {

    public GovernanceConfigurationException(String message) {
        super(message);
    }

    public GovernanceConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
