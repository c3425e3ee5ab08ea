package com.synthgov.core.advisory;

import com.synthgov.core.GovernanceEngine;
import com.synthgov.core.TestCatalogs;
import com.synthgov.core.aggregate.DatasetRiskSummary;
import com.synthgov.core.model.ThreatSignal;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SpringAiNarratorTest {

    private final DatasetRiskSummary summary = new GovernanceEngine(TestCatalogs.standard())
            .evaluate(Map.of("membership_inference_auc", 0.9, "privacy_score", Double.NaN))
            .getDatasetRiskSummary();

    @Test
    void unavailableWithoutClient() {
        SpringAiNarrator narrator = new SpringAiNarrator(null);

        assertThat(narrator.isAvailable()).isFalse();
        assertThat(narrator.narrate(summary)).isEmpty();
    }

    @Test
    void callsClientAndTrimsText() {
        FakeChatClient client = new FakeChatClient("  Membership inference dominates this dataset.  \n");
        SpringAiNarrator narrator = new SpringAiNarrator(client);

        assertThat(narrator.narrate(summary)).contains("Membership inference dominates this dataset.");
        assertThat(client.lastPrompt).contains("Overall risk level: critical")
                .contains("Membership Inference Attack")
                .contains("not authorized to approve or reject");
    }

    @Test
    void promptCarriesUncertaintyButNoRawEvidence() {
        String prompt = new SpringAiNarrator(new FakeChatClient("ok")).buildPrompt(summary);

        assertThat(prompt).contains("Uncertainty:")
                .contains("- metric privacy_score was non-finite (NaN), value discarded")
                .doesNotContain("evidence");
    }

    @Test
    void promptListsTopThreatsInOrder() {
        String prompt = new SpringAiNarrator(new FakeChatClient("ok")).buildPrompt(summary);

        assertThat(summary.getTopThreats()).isNotEmpty();
        ThreatSignal first = summary.getTopThreats().get(0);
        assertThat(prompt).contains(String.format(Locale.ROOT, "[1] %s severity=%s confidence=%.2f conditions=%s",
                first.getThreatName(), first.getSeverity().id(), first.getConfidence(),
                first.getTriggeredConditions()));
        assertThat(prompt).doesNotContain("[" + (summary.getTopThreats().size() + 1) + "]");
    }

    @Test
    void blankResponseGivesNoAdvisory() {
        assertThat(new SpringAiNarrator(new FakeChatClient("   ")).narrate(summary)).isEmpty();
    }

    @Test
    void clientFailureGivesNoAdvisory() {
        assertThat(new SpringAiNarrator(new FakeChatClient(null)).narrate(summary)).isEmpty();
        assertThat(new SpringAiNarrator(new Object()).narrate(summary)).isEmpty();
    }

    /** Mirrors the fluent prompt().call().content() shape of a chat client. */
    public static class FakeChatClient {
        private final String reply;
        String lastPrompt;

        FakeChatClient(String reply) {
            this.reply = reply;
        }

        public Request prompt(String prompt) {
            this.lastPrompt = prompt;
            return new Request();
        }

        public class Request {
            public Response call() {
                if (reply == null) {
                    throw new IllegalStateException("provider unreachable");
                }
                return new Response();
            }
        }

        public class Response {
            public String content() {
                return reply;
            }
        }
    }
}
