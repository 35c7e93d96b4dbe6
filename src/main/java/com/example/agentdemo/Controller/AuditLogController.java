package com.example.agentdemo.Controller;

import com.example.agentdemo.DTO.AuditLogDto;
import com.example.agentdemo.Service.AuditLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/audit-logs")
public class AuditLogController {
    private final AuditLogService auditLogService;

    // 최근 100건
    @GetMapping
    public List<AuditLogDto> latest() {
        return auditLogService.latest();
    }
}
