package com.example.agentdemo.Service;

import com.example.agentdemo.DTO.DomainRequest;
import com.example.agentdemo.DTO.DomainResponse;
import com.example.agentdemo.Domain.Agent;
import com.example.agentdemo.Domain.AgentDomain;
import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.AuditAction;
import com.example.agentdemo.Repository.AgentDomainRepository;
import com.example.agentdemo.Repository.AgentRepository;
import com.example.agentdemo.Util.CustomException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DomainService {

    private static final String ENTITY_TYPE = "domain";

    private final AgentDomainRepository domainRepository;
    private final AgentRepository agentRepository;
    private final AuditLogService auditLogService;

    @Transactional
    public List<DomainResponse> listAll() {
        return domainRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(DomainResponse::fromEntity)
                .toList();
    }

    /**
     * 데모 화면용 목록
     * 활성 도메인 중 Final 에이전트가 하나 이상 있는 것만, 에이전트도 Final 만 노출
     */
    @Transactional
    public List<DomainResponse> listForDemo() {
        return domainRepository.findByActiveTrueOrderByNameAsc().stream()
                .map(d -> DomainResponse.fromEntity(d, Agent::isFinal))
                .filter(d -> !d.agents().isEmpty())
                .toList();
    }

    @Transactional
    public DomainResponse create(Users actor, DomainRequest req) {
        String name = req.getName().trim();
        if (domainRepository.existsByName(name)) {
            throw new CustomException("이미 존재하는 도메인 이름입니다.", HttpStatus.CONFLICT);
        }
        AgentDomain domain = AgentDomain.builder()
                .name(name)
                .description(req.getDescription())
                .createdBy(actor)
                .build();
        if (req.getActive() != null) {
            domain.update(name, req.getDescription(), req.getActive());
        }
        AgentDomain saved = domainRepository.save(domain);
        auditLogService.record(actor, AuditAction.CREATE, ENTITY_TYPE, saved.getId(), null, snapshot(saved));
        log.info("도메인 생성: id={}, name={}", saved.getId(), name);
        return DomainResponse.fromEntity(saved);
    }

    @Transactional
    public DomainResponse update(Users actor, UUID domainId, DomainRequest req) {
        AgentDomain domain = findDomain(domainId);
        String name = req.getName().trim();
        if (domainRepository.existsByNameAndIdNot(name, domainId)) {
            throw new CustomException("이미 존재하는 도메인 이름입니다.", HttpStatus.CONFLICT);
        }
        DomainSnapshot before = snapshot(domain);
        domain.update(name, req.getDescription(), req.getActive());
        auditLogService.record(actor, AuditAction.UPDATE, ENTITY_TYPE, domainId, before, snapshot(domain));
        return DomainResponse.fromEntity(domain);
    }

    // 에이전트가 남아 있는 도메인은 삭제 불가
    @Transactional
    public void delete(Users actor, UUID domainId) {
        AgentDomain domain = findDomain(domainId);
        if (agentRepository.existsByDomain_Id(domainId)) {
            throw new CustomException("에이전트가 등록된 도메인은 삭제할 수 없습니다.", HttpStatus.CONFLICT);
        }
        DomainSnapshot before = snapshot(domain);
        domainRepository.delete(domain);
        auditLogService.record(actor, AuditAction.DELETE, ENTITY_TYPE, domainId, before, null);
        log.info("도메인 삭제: id={}", domainId);
    }

    AgentDomain findDomain(UUID domainId) {
        return domainRepository.findById(domainId)
                .orElseThrow(() -> CustomException.notFound("도메인"));
    }

    private static DomainSnapshot snapshot(AgentDomain d) {
        return new DomainSnapshot(d.getName(), d.getDescription(), d.isActive());
    }

    record DomainSnapshot(String name, String description, boolean active) {
    }
}
