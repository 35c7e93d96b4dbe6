package com.example.agentdemo.Domain;

import com.example.agentdemo.Enum.MessageType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
@Entity
@Table(name = "chat_messages")
public class ChatMessage {

    @Id
    @GeneratedValue
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", nullable = false)
    private ChatSession session;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MessageType messageType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String messageText;

    @Column(columnDefinition = "TEXT")
    private String messageHtml;

    // 매칭된 질문/답변 (FK 아님: 질문이 삭제돼도 대화 기록은 남김)
    private UUID questionId;

    private UUID answerId;

    @Column(nullable = false)
    private LocalDateTime sentAt;

    @Builder
    public ChatMessage(ChatSession session, MessageType messageType, String messageText, String messageHtml,
            UUID questionId, UUID answerId, LocalDateTime sentAt) {
        this.session = session;
        this.messageType = messageType;
        this.messageText = messageText;
        this.messageHtml = messageHtml;
        this.questionId = questionId;
        this.answerId = answerId;
        this.sentAt = sentAt != null ? sentAt : LocalDateTime.now();
    }
}
