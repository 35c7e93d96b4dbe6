package com.example.agentdemo.Service;

import com.example.agentdemo.DTO.AgentRequest;
import com.example.agentdemo.DTO.AgentSummary;
import com.example.agentdemo.Domain.Agent;
import com.example.agentdemo.Domain.AgentDomain;
import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.AgentEnvironment;
import com.example.agentdemo.Enum.AuditAction;
import com.example.agentdemo.Enum.ContentStatus;
import com.example.agentdemo.Repository.AgentRepository;
import com.example.agentdemo.Util.CustomException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AgentService {

    private static final String ENTITY_TYPE = "agent";

    private final AgentRepository agentRepository;
    private final DomainService domainService;
    private final AuditLogService auditLogService;

    // domainId 가 있으면 해당 도메인의 에이전트만
    @Transactional
    public List<AgentSummary> list(UUID domainId) {
        List<Agent> agents = domainId != null
                ? agentRepository.findByDomain_IdOrderByCreatedAtDesc(domainId)
                : agentRepository.findAllByOrderByCreatedAtDesc();
        return agents.stream().map(AgentSummary::fromEntity).toList();
    }

    @Transactional
    public AgentSummary get(UUID agentId) {
        return AgentSummary.fromEntity(findAgent(agentId));
    }

    @Transactional
    public AgentSummary create(Users actor, AgentRequest req) {
        AgentDomain domain = domainService.findDomain(req.getDomainId());
        Agent agent = Agent.builder()
                .name(req.getName().trim())
                .environment(req.getEnvironment())
                .version(req.getVersion().trim())
                .developedBy(req.getDevelopedBy().trim())
                .description(req.getDescription())
                .domain(domain)
                .createdBy(actor)
                .build();
        Agent saved = agentRepository.save(agent);
        auditLogService.record(actor, AuditAction.CREATE, ENTITY_TYPE, saved.getId(), null, snapshot(saved));
        log.info("에이전트 생성: id={}, name={}, domain={}", saved.getId(), saved.getName(), domain.getName());
        return AgentSummary.fromEntity(saved);
    }

    @Transactional
    public AgentSummary update(Users actor, UUID agentId, AgentRequest req) {
        Agent agent = findAgent(agentId);
        AgentDomain domain = domainService.findDomain(req.getDomainId());
        AgentSnapshot before = snapshot(agent);
        agent.update(req.getName().trim(), req.getEnvironment(), req.getVersion().trim(),
                req.getDevelopedBy().trim(), req.getDescription(), domain);
        auditLogService.record(actor, AuditAction.UPDATE, ENTITY_TYPE, agentId, before, snapshot(agent));
        return AgentSummary.fromEntity(agent);
    }

    // 질문/답변/변형/채팅 기록까지 함께 삭제됨
    @Transactional
    public void delete(Users actor, UUID agentId) {
        Agent agent = findAgent(agentId);
        AgentSnapshot before = snapshot(agent);
        agentRepository.delete(agent);
        auditLogService.record(actor, AuditAction.DELETE, ENTITY_TYPE, agentId, before, null);
        log.info("에이전트 삭제: id={}", agentId);
    }

    @Transactional
    public AgentSummary updateStatus(Users actor, UUID agentId, ContentStatus status) {
        Agent agent = findAgent(agentId);
        ContentStatus old = agent.getStatus();
        agent.changeStatus(status);
        auditLogService.record(actor, AuditAction.UPDATE_STATUS, ENTITY_TYPE, agentId,
                Map.of("status", old), Map.of("status", status));
        log.info("에이전트 상태 변경: id={}, {} -> {}", agentId, old, status);
        return AgentSummary.fromEntity(agent);
    }

    /**
     * 데모 사용자가 접근 가능한 에이전트 (Final 만)
     */
    public Agent getFinalAgent(UUID agentId) {
        return agentRepository.findByIdAndStatus(agentId, ContentStatus.FINAL)
                .orElseThrow(() -> CustomException.notFound("에이전트"));
    }

    @Transactional
    public AgentSummary getFinalAgentSummary(UUID agentId) {
        return AgentSummary.fromEntity(getFinalAgent(agentId));
    }

    private Agent findAgent(UUID agentId) {
        return agentRepository.findById(agentId)
                .orElseThrow(() -> CustomException.notFound("에이전트"));
    }

    private static AgentSnapshot snapshot(Agent a) {
        return new AgentSnapshot(a.getName(), a.getEnvironment(), a.getVersion(), a.getDevelopedBy(),
                a.getDomain().getId(), a.getStatus());
    }

    record AgentSnapshot(String name, AgentEnvironment environment, String version, String developedBy,
            UUID domainId, ContentStatus status) {
    }
}
