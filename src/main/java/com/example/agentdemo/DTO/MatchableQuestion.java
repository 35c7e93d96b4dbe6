package com.example.agentdemo.DTO;

import java.util.List;
import java.util.UUID;

/**
 * 매칭에 쓰이는 질문 한 건 (Final 질문/답변 + 승인된 변형만 포함)
 */
public record MatchableQuestion(
        UUID questionId,
        UUID answerId,
        String questionText,
        AnswerPayload answer,
        List<String> questionVariants,
        List<AnswerPayload> answerVariants) {
}
