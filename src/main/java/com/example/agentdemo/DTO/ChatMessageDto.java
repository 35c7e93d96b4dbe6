package com.example.agentdemo.DTO;

import com.example.agentdemo.Domain.ChatMessage;
import com.example.agentdemo.Enum.MessageType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;
import java.util.UUID;

// REST 응답과 Redis 캐시에 같은 형태로 사용
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessageDto(
        UUID id,
        MessageType type,
        String text,
        String html,
        UUID questionId,
        UUID answerId,
        LocalDateTime timestamp) {

    public static ChatMessageDto fromEntity(ChatMessage m) {
        return new ChatMessageDto(
                m.getId(),
                m.getMessageType(),
                m.getMessageText(),
                m.getMessageHtml(),
                m.getQuestionId(),
                m.getAnswerId(),
                m.getSentAt());
    }
}
