package com.example.agentdemo.DTO;

import com.example.agentdemo.Domain.Agent;
import com.example.agentdemo.Domain.AgentDomain;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;

public record DomainResponse(
        UUID id,
        String name,
        String description,
        boolean active,
        LocalDateTime createdAt,
        List<AgentSummary> agents) {

    public static DomainResponse fromEntity(AgentDomain d) {
        return fromEntity(d, a -> true);
    }

    // 데모 화면은 Final 에이전트만 노출
    public static DomainResponse fromEntity(AgentDomain d, Predicate<Agent> agentFilter) {
        return new DomainResponse(
                d.getId(),
                d.getName(),
                d.getDescription(),
                d.isActive(),
                d.getCreatedAt(),
                d.getAgents().stream().filter(agentFilter).map(AgentSummary::fromEntity).toList());
    }
}
