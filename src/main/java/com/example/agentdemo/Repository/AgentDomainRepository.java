package com.example.agentdemo.Repository;

import com.example.agentdemo.Domain.AgentDomain;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AgentDomainRepository extends JpaRepository<AgentDomain, UUID> {

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, UUID id);

    List<AgentDomain> findAllByOrderByCreatedAtDesc();

    List<AgentDomain> findByActiveTrueOrderByNameAsc();
}
