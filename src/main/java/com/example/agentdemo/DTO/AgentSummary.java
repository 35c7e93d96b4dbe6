package com.example.agentdemo.DTO;

import com.example.agentdemo.Domain.Agent;
import com.example.agentdemo.Enum.AgentEnvironment;
import com.example.agentdemo.Enum.ContentStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record AgentSummary(
        UUID id,
        String name,
        AgentEnvironment environment,
        String version,
        String developedBy,
        String description,
        ContentStatus status,
        int accessCount,
        LocalDateTime lastUpdated,
        UUID domainId,
        String domainName) {

    public static AgentSummary fromEntity(Agent a) {
        return new AgentSummary(
                a.getId(),
                a.getName(),
                a.getEnvironment(),
                a.getVersion(),
                a.getDevelopedBy(),
                a.getDescription(),
                a.getStatus(),
                a.getAccessCount(),
                a.getLastUpdated(),
                a.getDomain().getId(),
                a.getDomain().getName());
    }
}
