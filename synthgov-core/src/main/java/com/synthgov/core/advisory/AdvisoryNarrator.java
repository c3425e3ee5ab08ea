package com.synthgov.core.advisory;

import com.synthgov.core.aggregate.DatasetRiskSummary;

import java.util.Optional;

/**
 * Abstraction for generated advisory prose about a risk summary.
 * Implementations wrap Spring AI's ChatClient for different providers.
 *
 * <p>
 * A narrator only ever sees the summary. Whatever it returns is attached next
 * to the result and can never alter a level, a signal or a note.
 * </p>
 */
public interface AdvisoryNarrator {

    /**
     * Describe the summary in plain language.
     * This is called off the caller's thread and may take seconds.
     *
     * @return the advisory text, or empty if none could be produced
     */
    Optional<String> narrate(DatasetRiskSummary summary);

    /**
     * Check if the narrator is available (client configured, service
     * reachable).
     */
    boolean isAvailable();
}
