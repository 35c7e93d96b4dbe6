package com.example.agentdemo.Repository;

import com.example.agentdemo.Domain.ChatMessage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

    // 최신순 10건 (호출 측에서 시간순으로 뒤집음)
    List<ChatMessage> findTop10BySession_IdOrderBySentAtDesc(UUID sessionId);
}
