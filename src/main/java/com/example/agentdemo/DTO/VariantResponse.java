package com.example.agentdemo.DTO;

import com.example.agentdemo.Domain.AnswerVariant;
import com.example.agentdemo.Domain.QuestionVariant;

import java.util.UUID;

public record VariantResponse(UUID id, String text, String html, boolean approved) {

    public static VariantResponse fromEntity(QuestionVariant v) {
        return new VariantResponse(v.getId(), v.getVariantText(), null, v.isApproved());
    }

    public static VariantResponse fromEntity(AnswerVariant v) {
        return new VariantResponse(v.getId(), v.getVariantText(), v.getVariantHtml(), v.isApproved());
    }
}
