package com.example.agentdemo.DTO;

import com.example.agentdemo.Domain.ChatSession;

import java.time.LocalDateTime;
import java.util.UUID;

public record ChatSessionSummary(
        UUID id,
        UUID agentId,
        String agentName,
        String domainName,
        LocalDateTime startedAt,
        LocalDateTime endedAt,
        boolean active) {

    public static ChatSessionSummary fromEntity(ChatSession s) {
        return new ChatSessionSummary(
                s.getId(),
                s.getAgent().getId(),
                s.getAgent().getName(),
                s.getAgent().getDomain().getName(),
                s.getStartedAt(),
                s.getEndedAt(),
                s.isActive());
    }
}
