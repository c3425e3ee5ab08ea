package com.synthgov.core.advisory;

import com.synthgov.core.GovernanceEngine;
import com.synthgov.core.assemble.GovernanceResult;
import com.synthgov.core.audit.AuditRecord;
import com.synthgov.core.audit.AuditSink;
import com.synthgov.core.config.GovernanceProperties;
import com.synthgov.core.model.OutputMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Service boundary around the {@link GovernanceEngine}. Runs the evaluation,
 * writes an audit record and, when enabled, asks the narrator for advisory
 * text on a separate executor.
 *
 * <p>
 * Audit and advisory failures are logged and swallowed here: the core result
 * is always returned as the engine produced it.
 * </p>
 */
public class GovernanceService {

    private static final Logger log = LoggerFactory.getLogger(GovernanceService.class);

    private final GovernanceEngine engine;
    private final AdvisoryNarrator narrator;
    private final AuditSink auditSink;
    private final GovernanceProperties properties;
    private final ExecutorService advisoryExecutor;
    private final Clock clock;

    /**
     * @param narrator         may be null when no advisory provider is configured
     * @param auditSink        may be null when auditing is disabled
     * @param advisoryExecutor runs narrator calls; a timed-out call is cancelled
     *                         by interrupting its worker thread
     */
    public GovernanceService(GovernanceEngine engine, AdvisoryNarrator narrator, AuditSink auditSink,
            GovernanceProperties properties, ExecutorService advisoryExecutor, Clock clock) {
        this.engine = engine;
        this.narrator = narrator;
        this.auditSink = auditSink;
        this.properties = properties;
        this.advisoryExecutor = advisoryExecutor;
        this.clock = clock;
    }

    public AdvisedGovernanceResult evaluate(Object metrics) {
        return evaluate(metrics, engine.getDefaultMode());
    }

    public AdvisedGovernanceResult evaluate(Object metrics, String mode) {
        return evaluate(metrics, OutputMode.fromId(mode));
    }

    /**
     * @throws com.synthgov.core.GovernanceContractException if the input is not a metric map
     */
    public AdvisedGovernanceResult evaluate(Object metrics, OutputMode mode) {
        GovernanceResult result = engine.evaluate(metrics, mode);
        String evaluationId = UUID.randomUUID().toString();

        audit(evaluationId, result);
        String advisory = advise(result).orElse(null);

        return new AdvisedGovernanceResult(evaluationId, result, advisory);
    }

    private void audit(String evaluationId, GovernanceResult result) {
        if (auditSink == null || !properties.getAudit().isEnabled()) {
            return;
        }
        try {
            auditSink.record(AuditRecord.of(evaluationId, Instant.now(clock), result));
        } catch (Exception e) {
            // An audit failure never fails the evaluation
            log.error("[SynthGov] Audit sink failed for evaluation {}: {}", evaluationId, e.getMessage());
        }
    }

    private Optional<String> advise(GovernanceResult result) {
        if (narrator == null || !properties.getAdvisory().isEnabled() || !narrator.isAvailable()) {
            return Optional.empty();
        }

        long timeoutMillis = properties.getAdvisory().getTimeoutMillis();
        Future<Optional<String>> future = null;
        try {
            future = advisoryExecutor.submit(() -> narrator.narrate(result.getDatasetRiskSummary()));
            Optional<String> text = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            return text != null ? text : Optional.empty();
        } catch (RejectedExecutionException e) {
            log.warn("[SynthGov] Advisory executor rejected the narration, returning result without it: {}",
                    e.getMessage());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[SynthGov] Advisory narration timed out after {} ms, returning result without it",
                    timeoutMillis);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[SynthGov] Advisory narration failed: {}", cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("[SynthGov] Interrupted while waiting for advisory narration");
        }
        return Optional.empty();
    }
}
