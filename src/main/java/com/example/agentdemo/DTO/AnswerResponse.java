package com.example.agentdemo.DTO;

import com.example.agentdemo.Domain.Answer;
import com.example.agentdemo.Enum.ContentStatus;

import java.util.List;
import java.util.UUID;

public record AnswerResponse(
        UUID id,
        String answerText,
        String answerHtml,
        ContentStatus status,
        List<VariantResponse> variants) {

    public static AnswerResponse fromEntity(Answer a) {
        return new AnswerResponse(
                a.getId(),
                a.getAnswerText(),
                a.getAnswerHtml(),
                a.getStatus(),
                a.getVariants().stream().map(VariantResponse::fromEntity).toList());
    }
}
