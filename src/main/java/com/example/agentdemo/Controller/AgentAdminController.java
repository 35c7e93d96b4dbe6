package com.example.agentdemo.Controller;

import com.example.agentdemo.DTO.AgentRequest;
import com.example.agentdemo.DTO.AgentSummary;
import com.example.agentdemo.DTO.StatusUpdateRequest;
import com.example.agentdemo.Service.AgentService;
import com.example.agentdemo.Service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/agents")
public class AgentAdminController {
    private final AgentService agentService;
    private final AuthService authService;

    @GetMapping
    public List<AgentSummary> list(@RequestParam(required = false) UUID domainId) {
        return agentService.list(domainId);
    }

    @GetMapping("/{id}")
    public AgentSummary get(@PathVariable UUID id) {
        return agentService.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AgentSummary create(@Valid @RequestBody AgentRequest req, Authentication authentication) {
        return agentService.create(authService.findActiveUser(authentication.getName()), req);
    }

    @PutMapping("/{id}")
    public AgentSummary update(@PathVariable UUID id, @Valid @RequestBody AgentRequest req,
            Authentication authentication) {
        return agentService.update(authService.findActiveUser(authentication.getName()), id, req);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id, Authentication authentication) {
        agentService.delete(authService.findActiveUser(authentication.getName()), id);
    }

    @PutMapping("/{id}/status")
    public AgentSummary updateStatus(@PathVariable UUID id, @Valid @RequestBody StatusUpdateRequest req,
            Authentication authentication) {
        return agentService.updateStatus(authService.findActiveUser(authentication.getName()), id, req.getStatus());
    }
}
