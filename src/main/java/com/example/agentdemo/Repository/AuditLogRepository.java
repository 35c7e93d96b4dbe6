package com.example.agentdemo.Repository;

import com.example.agentdemo.Domain.AuditLog;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    @EntityGraph(attributePaths = {"user"})
    List<AuditLog> findTop100ByOrderByCreatedAtDesc();
}
