package com.example.agentdemo.Repository;

import com.example.agentdemo.Domain.ChatSession;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ChatSessionRepository extends JpaRepository<ChatSession, UUID> {

    List<ChatSession> findByUser_IdAndAgent_IdAndActiveTrue(Long userId, UUID agentId);

    Optional<ChatSession> findByIdAndUser_Id(UUID id, Long userId);

    Optional<ChatSession> findByIdAndUser_IdAndActiveTrue(UUID id, Long userId);

    @EntityGraph(attributePaths = {"agent", "agent.domain"})
    List<ChatSession> findTop20ByUser_IdOrderByStartedAtDesc(Long userId);
}
