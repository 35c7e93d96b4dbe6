package com.example.agentdemo.DTO;

import com.example.agentdemo.Domain.AuditLog;
import com.example.agentdemo.Enum.AuditAction;

import java.time.LocalDateTime;
import java.util.UUID;

public record AuditLogDto(
        UUID id,
        String userId,
        AuditAction action,
        String entityType,
        String entityId,
        String oldValues,
        String newValues,
        String ipAddress,
        LocalDateTime createdAt) {

    public static AuditLogDto fromEntity(AuditLog log) {
        return new AuditLogDto(
                log.getId(),
                log.getUser().getUserId(),
                log.getAction(),
                log.getEntityType(),
                log.getEntityId(),
                log.getOldValues(),
                log.getNewValues(),
                log.getIpAddress(),
                log.getCreatedAt());
    }
}
