package com.synthgov.core.advisory;

import com.synthgov.core.aggregate.DatasetRiskSummary;
import com.synthgov.core.model.ThreatSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Default narrator implementation using Spring AI's ChatClient.
 * Works with any OpenAI-compatible provider (OpenAI, Ollama, NVIDIA NIM).
 */
public class SpringAiNarrator implements AdvisoryNarrator {

    private static final Logger log = LoggerFactory.getLogger(SpringAiNarrator.class);

    private static final String SYSTEM_ROLE = "You are SynthGov, an advisory interpreter of synthetic data risk. "
            + "You are not authorized to approve or reject datasets or to change any finding below. "
            + "Explain the significance of the findings for a human reviewer, name one risk the findings "
            + "may not fully capture, and suggest one concrete re-evaluation trigger. "
            + "Answer in at most three short paragraphs of plain text.";

    private final Object chatClient; // Spring AI ChatClient (Object to avoid hard dependency)
    private final boolean available;

    public SpringAiNarrator(Object chatClient) {
        this.chatClient = chatClient;
        this.available = chatClient != null;
        if (available) {
            log.info("[SynthGov] Advisory narrator initialized with Spring AI ChatClient");
        } else {
            log.warn("[SynthGov] Advisory narrator not available, no ChatClient configured. "
                    + "Results will carry no advisory text.");
        }
    }

    @Override
    public Optional<String> narrate(DatasetRiskSummary summary) {
        if (!available) {
            return Optional.empty();
        }

        try {
            String response = callAi(buildPrompt(summary));
            if (response == null || response.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(response.trim());
        } catch (Exception e) {
            log.error("[SynthGov] Advisory narration failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    String buildPrompt(DatasetRiskSummary summary) {
        Map<String, Object> view = summary.toMap();
        StringBuilder sb = new StringBuilder();
        sb.append(SYSTEM_ROLE).append("\n\n");
        sb.append("Findings (final, do not modify):\n");
        sb.append("Overall risk level: ").append(view.get("overall_risk_level")).append('\n');
        sb.append("Severity breakdown: ").append(view.get("severity_breakdown")).append('\n');
        sb.append("Impacted properties: ").append(view.get("property_breakdown")).append('\n');
        sb.append("Summary: ").append(view.get("summary")).append('\n');

        sb.append("\nTop threats:\n");
        List<ThreatSignal> top = summary.getTopThreats();
        for (int i = 0; i < top.size(); i++) {
            ThreatSignal threat = top.get(i);
            sb.append(String.format(Locale.ROOT, "[%d] %s severity=%s confidence=%.2f conditions=%s\n",
                    i + 1, threat.getThreatName(), threat.getSeverity().id(),
                    threat.getConfidence(), threat.getTriggeredConditions()));
        }

        if (summary.hasUncertainty()) {
            sb.append("\nUncertainty:\n");
            summary.getUncertaintyNotes().forEach(note -> sb.append("- ").append(note).append('\n'));
        }
        return sb.toString();
    }

    private String callAi(String prompt) {
        // Uses reflection to avoid compile-time dependency on Spring AI
        try {
            var clientClass = chatClient.getClass();
            var promptMethod = clientClass.getMethod("prompt", String.class);
            var callObj = promptMethod.invoke(chatClient, prompt);
            var callMethod = callObj.getClass().getMethod("call");
            var responseObj = callMethod.invoke(callObj);
            var contentMethod = responseObj.getClass().getMethod("content");
            return (String) contentMethod.invoke(responseObj);
        } catch (Exception e) {
            log.error("[SynthGov] Failed to call AI: {}", e.getMessage());
            throw new IllegalStateException("AI call failed", e);
        }
    }
}
