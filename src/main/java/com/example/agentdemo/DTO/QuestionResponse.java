package com.example.agentdemo.DTO;

import com.example.agentdemo.Domain.Question;
import com.example.agentdemo.Enum.ContentStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

// 관리자 화면용: 질문 + 답변 + 모든 변형(승인 여부 포함)
public record QuestionResponse(
        UUID id,
        UUID agentId,
        String questionText,
        ContentStatus status,
        LocalDateTime createdAt,
        AnswerResponse answer,
        List<VariantResponse> variants) {

    public static QuestionResponse fromEntity(Question q) {
        return new QuestionResponse(
                q.getId(),
                q.getAgent().getId(),
                q.getQuestionText(),
                q.getStatus(),
                q.getCreatedAt(),
                q.getAnswer() != null ? AnswerResponse.fromEntity(q.getAnswer()) : null,
                q.getVariants().stream().map(VariantResponse::fromEntity).toList());
    }
}
