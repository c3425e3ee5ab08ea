package com.synthgov.core;

import com.synthgov.core.aggregate.DatasetRiskSummary;
import com.synthgov.core.aggregate.RiskAggregator;
import com.synthgov.core.assemble.GovernanceResult;
import com.synthgov.core.assemble.ResultAssembler;
import com.synthgov.core.catalog.ThreatCatalog;
import com.synthgov.core.config.GovernanceProperties;
import com.synthgov.core.mapping.MappingResult;
import com.synthgov.core.mapping.ThreatMapper;
import com.synthgov.core.model.OutputMode;
import com.synthgov.core.sanitize.MetricSanitizer;
import com.synthgov.core.sanitize.SanitizedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * The brain of SynthGov.
 * Runs one metric dictionary through sanitizer, mapper, aggregator and
 * assembler and hands back a read-only result.
 *
 * <p>
 * The engine holds only immutable state, so a single instance can serve any
 * number of threads. It never decides anything about a dataset: the result
 * describes risk, nothing more.
 * </p>
 */
public class GovernanceEngine {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEngine.class);

    private final ThreatCatalog catalog;
    private final MetricSanitizer sanitizer;
    private final ThreatMapper mapper;
    private final RiskAggregator aggregator;
    private final ResultAssembler assembler;
    private final OutputMode defaultMode;

    /**
     * @throws GovernanceConfigurationException if the properties hold an unknown
     *                                          output mode or non-positive limits
     */
    public GovernanceEngine(ThreatCatalog catalog, GovernanceProperties properties, Clock clock) {
        this.catalog = catalog;
        this.sanitizer = new MetricSanitizer(catalog);
        this.mapper = new ThreatMapper(catalog);
        this.aggregator = new RiskAggregator(properties.getTopThreatsLimit());
        this.assembler = new ResultAssembler(clock, properties.getEvidenceLimit(), properties.toConfigEcho());
        try {
            this.defaultMode = OutputMode.fromId(properties.getOutputMode());
        } catch (GovernanceContractException e) {
            throw new GovernanceConfigurationException("synthgov.output-mode: " + e.getMessage(), e);
        }
        log.info("[SynthGov] Engine started with {} rule(s), default mode '{}'",
                catalog.size(), defaultMode.id());
    }

    public GovernanceEngine(ThreatCatalog catalog, GovernanceProperties properties) {
        this(catalog, properties, Clock.systemUTC());
    }

    public GovernanceEngine(ThreatCatalog catalog) {
        this(catalog, new GovernanceProperties());
    }

    /** Evaluates in the configured default mode. */
    public GovernanceResult evaluate(Object metrics) {
        return evaluate(metrics, defaultMode);
    }

    /**
     * @throws GovernanceContractException for an unknown mode name
     */
    public GovernanceResult evaluate(Object metrics, String mode) {
        return evaluate(metrics, OutputMode.fromId(mode));
    }

    /**
     * Evaluates a metric dictionary. Missing or malformed values never fail the
     * call; they surface as uncertainty notes on the result.
     *
     * @param metrics flat or nested map keyed by metric name
     * @throws GovernanceContractException if {@code metrics} is not a map with
     *                                     string keys, or {@code mode} is null
     */
    public GovernanceResult evaluate(Object metrics, OutputMode mode) {
        Map<?, ?> raw = requireMetricMap(metrics);
        if (mode == null) {
            throw new GovernanceContractException("Output mode must not be null");
        }

        SanitizedMetrics sanitized = sanitizer.sanitize(raw);
        MappingResult mapping = mapper.map(sanitized.snapshot());
        DatasetRiskSummary summary = aggregator.aggregate(mapping, sanitized.issues());

        if (summary.hasUncertainty()) {
            log.debug("[SynthGov] Evaluation carries {} uncertainty note(s)", summary.getUncertaintyNotes().size());
        }
        log.debug("[SynthGov] Evaluated {} rule(s): {} signal(s), overall {}",
                mapping.evaluatedRules(), mapping.signals().size(), summary.getOverallRiskLevel().id());

        return assembler.assemble(summary, mapping.signals(), mode);
    }

    public ThreatCatalog getCatalog() {
        return catalog;
    }

    public OutputMode getDefaultMode() {
        return defaultMode;
    }

    private static Map<?, ?> requireMetricMap(Object metrics) {
        if (metrics == null) {
            throw new GovernanceContractException("Metrics must not be null");
        }
        if (!(metrics instanceof Map<?, ?> map)) {
            throw new GovernanceContractException(
                    "Metrics must be a map of metric name to value, got " + metrics.getClass().getSimpleName());
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new GovernanceContractException("Metric names must be strings, got "
                        + (key == null ? "null" : key.getClass().getSimpleName()));
            }
        }
        return map;
    }
}
