package com.example.agentdemo.Controller;

import com.example.agentdemo.DTO.DomainRequest;
import com.example.agentdemo.DTO.DomainResponse;
import com.example.agentdemo.Service.AuthService;
import com.example.agentdemo.Service.DomainService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/domains")
public class DomainAdminController {
    private final DomainService domainService;
    private final AuthService authService;

    @GetMapping
    public List<DomainResponse> list() {
        return domainService.listAll();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DomainResponse create(@Valid @RequestBody DomainRequest req, Authentication authentication) {
        return domainService.create(authService.findActiveUser(authentication.getName()), req);
    }

    @PutMapping("/{id}")
    public DomainResponse update(@PathVariable UUID id, @Valid @RequestBody DomainRequest req,
            Authentication authentication) {
        return domainService.update(authService.findActiveUser(authentication.getName()), id, req);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id, Authentication authentication) {
        domainService.delete(authService.findActiveUser(authentication.getName()), id);
    }
}
