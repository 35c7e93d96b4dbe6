package com.example.agentdemo.Repository;

import com.example.agentdemo.Domain.Agent;
import com.example.agentdemo.Enum.ContentStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AgentRepository extends JpaRepository<Agent, UUID> {

    List<Agent> findAllByOrderByCreatedAtDesc();

    List<Agent> findByDomain_IdOrderByCreatedAtDesc(UUID domainId);

    Optional<Agent> findByIdAndStatus(UUID id, ContentStatus status);

    boolean existsByDomain_Id(UUID domainId);
}
