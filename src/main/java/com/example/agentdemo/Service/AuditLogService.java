package com.example.agentdemo.Service;

import com.example.agentdemo.DTO.AuditLogDto;
import com.example.agentdemo.Domain.AuditLog;
import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.AuditAction;
import com.example.agentdemo.Repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.List;

/**
 * 관리자 변경 이력 기록
 * 호출한 서비스의 트랜잭션 안에서 함께 저장된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper om;

    public void record(Users actor, AuditAction action, String entityType, Object entityId,
            Object oldValues, Object newValues) {
        HttpServletRequest request = currentRequest();
        AuditLog entry = AuditLog.builder()
                .user(actor)
                .action(action)
                .entityType(entityType)
                .entityId(entityId != null ? String.valueOf(entityId) : null)
                .oldValues(toJson(oldValues))
                .newValues(toJson(newValues))
                .ipAddress(request != null ? request.getRemoteAddr() : null)
                .userAgent(request != null ? request.getHeader("User-Agent") : null)
                .build();
        auditLogRepository.save(entry);
        log.info("감사 로그 기록: user={}, action={}, entity={}:{}", actor.getUserId(), action, entityType, entityId);
    }

    public List<AuditLogDto> latest() {
        return auditLogRepository.findTop100ByOrderByCreatedAtDesc().stream()
                .map(AuditLogDto::fromEntity)
                .toList();
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // 스냅샷 직렬화 실패는 기록만 남기고 값은 비워 둠
            log.warn("감사 로그 스냅샷 직렬화 실패: type={}", value.getClass().getSimpleName(), e);
            return null;
        }
    }

    private static HttpServletRequest currentRequest() {
        RequestAttributes attrs = RequestContextHolder.getRequestAttributes();
        if (attrs instanceof ServletRequestAttributes servletAttrs) {
            return servletAttrs.getRequest();
        }
        return null;
    }
}
