package com.example.agentdemo.Service;

import com.example.agentdemo.DTO.AnswerPayload;
import com.example.agentdemo.DTO.MatchResult;
import com.example.agentdemo.DTO.MatchableQuestion;
import com.example.agentdemo.Variant.StubRandom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnswerMatchServiceTest {

    private static final UUID AGENT_ID = UUID.randomUUID();

    private QuestionService questionService;
    private AnswerMatchService matcher;

    @BeforeEach
    void setUp() {
        questionService = mock(QuestionService.class);
        matcher = new AnswerMatchService(questionService, new TextSimilarityService(), new StubRandom(0.5, 1));
    }

    @Test
    void closeQuestion_returnsOriginalAnswer() {
        MatchableQuestion returns = question("What is your return policy?",
                new AnswerPayload("30 days.", "<p>30 days.</p>"), List.of(), List.of());
        when(questionService.listMatchCandidates(AGENT_ID)).thenReturn(List.of(returns));

        MatchResult result = matcher.match(AGENT_ID, "what's the return policy");

        assertThat(result.matched()).isTrue();
        assertThat(result.questionId()).isEqualTo(returns.questionId());
        assertThat(result.answerId()).isEqualTo(returns.answerId());
        assertThat(result.text()).isEqualTo("30 days.");
        assertThat(result.html()).isEqualTo("<p>30 days.</p>");
        assertThat(result.score()).isEqualTo(0.75);
    }

    @Test
    void unrelatedUtterance_returnsNoMatchFallback() {
        when(questionService.listMatchCandidates(AGENT_ID)).thenReturn(List.of(
                question("What is your return policy?", new AnswerPayload("30 days.", "<p>30 days.</p>"),
                        List.of(), List.of())));

        MatchResult result = matcher.match(AGENT_ID, "Tell me about the weather");

        assertThat(result.matched()).isFalse();
        assertThat(result.text()).isEqualTo(AnswerMatchService.NO_MATCH_MESSAGE);
        assertThat(result.html()).isEqualTo(AnswerMatchService.NO_MATCH_MESSAGE);
    }

    @Test
    void noCandidates_returnsNoMatchFallback() {
        when(questionService.listMatchCandidates(AGENT_ID)).thenReturn(List.of());

        assertThat(matcher.match(AGENT_ID, "anything at all").text()).isEqualTo(AnswerMatchService.NO_MATCH_MESSAGE);
    }

    @Test
    void variantWin_answersWithRandomAnswerVariant() {
        List<AnswerPayload> answerVariants = List.of(
                new AnswerPayload("Variant A", "<p>Variant A</p>"),
                new AnswerPayload("Variant B", "<p>Variant B</p>"));
        when(questionService.listMatchCandidates(AGENT_ID)).thenReturn(List.of(
                question("Billing cycle dates", new AnswerPayload("Original", "<p>Original</p>"),
                        List.of("What is the process to reset my password?"), answerVariants)));

        MatchResult result = matcher.match(AGENT_ID, "process to reset password");

        // StubRandom.nextInt → 1
        assertThat(result.text()).isEqualTo("Variant B");
        assertThat(result.html()).isEqualTo("<p>Variant B</p>");
    }

    @Test
    void variantWinWithoutApprovedAnswerVariants_usesOriginalAnswer() {
        when(questionService.listMatchCandidates(AGENT_ID)).thenReturn(List.of(
                question("Billing cycle dates", new AnswerPayload("Original", "<p>Original</p>"),
                        List.of("What is the process to reset my password?"), List.of())));

        assertThat(matcher.match(AGENT_ID, "process to reset password").text()).isEqualTo("Original");
    }

    @Test
    void tie_keepsFirstCandidate() {
        MatchableQuestion first = question("reset password", new AnswerPayload("first", "first"), List.of(), List.of());
        MatchableQuestion second = question("reset password", new AnswerPayload("second", "second"), List.of(), List.of());
        when(questionService.listMatchCandidates(AGENT_ID)).thenReturn(List.of(first, second));

        MatchResult result = matcher.match(AGENT_ID, "reset password");

        assertThat(result.questionId()).isEqualTo(first.questionId());
        assertThat(result.text()).isEqualTo("first");
    }

    @Test
    void scoreExactlyAtThreshold_isNotAMatch() {
        // 3 / max(3, 10) = 0.3
        when(questionService.listMatchCandidates(AGENT_ID)).thenReturn(List.of(
                question("reset password account alpha bravo charlie delta echo foxtrot golf",
                        new AnswerPayload("x", "x"), List.of(), List.of())));

        MatchResult result = matcher.match(AGENT_ID, "reset password account");

        assertThat(result.matched()).isFalse();
        assertThat(result.text()).isEqualTo(AnswerMatchService.NO_MATCH_MESSAGE);
    }

    @Test
    void lookupFailure_returnsErrorFallback() {
        when(questionService.listMatchCandidates(AGENT_ID)).thenThrow(new IllegalStateException("db down"));

        MatchResult result = matcher.match(AGENT_ID, "what's the return policy");

        assertThat(result.matched()).isFalse();
        assertThat(result.text()).isEqualTo(AnswerMatchService.ERROR_MESSAGE);
    }

    private static MatchableQuestion question(String text, AnswerPayload answer,
            List<String> questionVariants, List<AnswerPayload> answerVariants) {
        return new MatchableQuestion(UUID.randomUUID(), UUID.randomUUID(), text, answer,
                questionVariants, answerVariants);
    }
}
