package com.example.agentdemo.Controller;

import com.example.agentdemo.DTO.AgentSummary;
import com.example.agentdemo.DTO.ChatExchangeResponse;
import com.example.agentdemo.DTO.ChatMessageDto;
import com.example.agentdemo.DTO.ChatMessageRequest;
import com.example.agentdemo.DTO.ChatSessionSummary;
import com.example.agentdemo.DTO.ChatStartResponse;
import com.example.agentdemo.DTO.DomainResponse;
import com.example.agentdemo.Service.AgentService;
import com.example.agentdemo.Service.AuthService;
import com.example.agentdemo.Service.ChatService;
import com.example.agentdemo.Service.DomainService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * 데모 사용자 화면: Final 에이전트 탐색과 채팅
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/demo")
public class DemoController {
    private final DomainService domainService;
    private final AgentService agentService;
    private final ChatService chatService;
    private final AuthService authService;

    @GetMapping("/domains")
    public List<DomainResponse> domains() {
        return domainService.listForDemo();
    }

    @GetMapping("/agents/{id}")
    public AgentSummary agent(@PathVariable UUID id) {
        return agentService.getFinalAgentSummary(id);
    }

    @PostMapping("/agents/{id}/chat/start")
    @ResponseStatus(HttpStatus.CREATED)
    public ChatStartResponse start(@PathVariable UUID id, Authentication authentication) {
        return chatService.start(authService.findActiveUser(authentication.getName()), id);
    }

    @PostMapping("/chat/{sessionId}/message")
    public ChatExchangeResponse message(@PathVariable UUID sessionId, @Valid @RequestBody ChatMessageRequest req,
            Authentication authentication) {
        return chatService.sendMessage(authService.findActiveUser(authentication.getName()), sessionId, req.getMessage());
    }

    @GetMapping("/chat/{sessionId}/history")
    public List<ChatMessageDto> history(@PathVariable UUID sessionId, Authentication authentication) {
        return chatService.history(authService.findActiveUser(authentication.getName()), sessionId);
    }

    @PostMapping("/chat/{sessionId}/end")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void end(@PathVariable UUID sessionId, Authentication authentication) {
        chatService.end(authService.findActiveUser(authentication.getName()), sessionId);
    }

    @GetMapping("/chat/sessions")
    public List<ChatSessionSummary> sessions(Authentication authentication) {
        return chatService.recentSessions(authService.findActiveUser(authentication.getName()));
    }
}
