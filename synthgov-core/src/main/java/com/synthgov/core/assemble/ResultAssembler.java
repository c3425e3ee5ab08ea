package com.synthgov.core.assemble;

import com.synthgov.core.GovernanceConfigurationException;
import com.synthgov.core.aggregate.DatasetRiskSummary;
import com.synthgov.core.model.OutputMode;
import com.synthgov.core.model.ThreatSignal;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shapes already derived data into a {@link GovernanceResult}. Performs no
 * analysis of its own.
 */
public class ResultAssembler {

    public static final String ENGINE_VERSION = "2.1.0";

    public static final int DEFAULT_EVIDENCE_LIMIT = 1;

    public static final List<String> DISCLAIMERS = List.of(
            "This assessment is advisory only and does not constitute compliance certification",
            "Risk levels are interpretive and should inform, not replace, human decision-making",
            "No approval or rejection decisions are made by this system");

    private final Clock clock;
    private final int evidenceLimit;
    private final Map<String, Object> configEcho;

    /**
     * @param configEcho settings reported back under {@code metadata.config}
     */
    public ResultAssembler(Clock clock, int evidenceLimit, Map<String, Object> configEcho) {
        if (evidenceLimit < 1) {
            throw new GovernanceConfigurationException("evidence-limit must be at least 1, was " + evidenceLimit);
        }
        this.clock = clock;
        this.evidenceLimit = evidenceLimit;
        this.configEcho = Map.copyOf(configEcho);
    }

    public GovernanceResult assemble(DatasetRiskSummary summary, List<ThreatSignal> signals, OutputMode mode) {
        List<ThreatSignal> threats = switch (mode) {
            case SUMMARY -> null;
            case DETAILED -> signals.stream().map(s -> s.truncated(evidenceLimit)).collect(Collectors.toList());
            case FULL -> signals;
        };
        return new GovernanceResult(summary, threats, mode, DISCLAIMERS, metadata(mode));
    }

    private Map<String, Object> metadata(OutputMode mode) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", ENGINE_VERSION);
        metadata.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS)));
        metadata.put("mode", mode.id());
        Map<String, Object> config = new LinkedHashMap<>();
        configEcho.keySet().stream().sorted().forEach(key -> config.put(key, configEcho.get(key)));
        metadata.put("config", config);
        return metadata;
    }
}
