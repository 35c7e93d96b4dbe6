package com.example.agentdemo.Service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextSimilarityServiceTest {

    private final TextSimilarityService similarity = new TextSimilarityService();

    @Test
    void partialOverlap_countsSubstringMatches() {
        // what's~what, return, policy~policy? / max(4, 4)
        assertThat(similarity.score("what's the return policy", "What is your return policy?"))
                .isCloseTo(0.75, within(1e-9));
    }

    @Test
    void identicalText_scoresOne() {
        assertThat(similarity.score("How do I reset my password?", "How do I reset my password?"))
                .isEqualTo(1.0);
    }

    @Test
    void emptyOrShortTokensOnly_scoresZero() {
        assertThat(similarity.score("", "What is your return policy?")).isZero();
        assertThat(similarity.score("is it ok", "What is your return policy?")).isZero();
        assertThat(similarity.score("return policy", "<p></p>")).isZero();
    }

    @Test
    void score_isAlwaysWithinUnitRange() {
        String[] texts = {"reset password", "password password password", "How do I reset my password today?",
                "returns", "<b>Return</b> policy details for damaged goods"};
        for (String a : texts) {
            for (String b : texts) {
                assertThat(similarity.score(a, b)).isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    void unrelatedText_scoresLow() {
        assertThat(similarity.score("Tell me about the weather", "What is your return policy?"))
                .isLessThanOrEqualTo(AnswerMatchService.MATCH_THRESHOLD);
    }
}
