package com.example.agentdemo.Controller;

import com.example.agentdemo.DTO.ApprovalRequest;
import com.example.agentdemo.DTO.QuestionRequest;
import com.example.agentdemo.DTO.QuestionResponse;
import com.example.agentdemo.DTO.StatusUpdateRequest;
import com.example.agentdemo.DTO.VariantResponse;
import com.example.agentdemo.Service.AuthService;
import com.example.agentdemo.Service.QuestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * 질문/답변 및 변형 승인 관리
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/admin")
public class QuestionAdminController {
    private final QuestionService questionService;
    private final AuthService authService;

    @GetMapping("/agents/{agentId}/questions")
    public List<QuestionResponse> list(@PathVariable UUID agentId) {
        return questionService.listForAgent(agentId);
    }

    @PostMapping("/agents/{agentId}/questions")
    @ResponseStatus(HttpStatus.CREATED)
    public QuestionResponse create(@PathVariable UUID agentId, @Valid @RequestBody QuestionRequest req,
            Authentication authentication) {
        return questionService.createQuestion(authService.findActiveUser(authentication.getName()), agentId, req);
    }

    @PutMapping("/questions/{id}")
    public QuestionResponse update(@PathVariable UUID id, @Valid @RequestBody QuestionRequest req,
            Authentication authentication) {
        return questionService.updateQuestion(authService.findActiveUser(authentication.getName()), id, req);
    }

    @DeleteMapping("/questions/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id, Authentication authentication) {
        questionService.deleteQuestion(authService.findActiveUser(authentication.getName()), id);
    }

    @PutMapping("/questions/{id}/status")
    public QuestionResponse updateStatus(@PathVariable UUID id, @Valid @RequestBody StatusUpdateRequest req,
            Authentication authentication) {
        return questionService.updateStatus(authService.findActiveUser(authentication.getName()), id, req.getStatus());
    }

    @PutMapping("/question-variants/{id}/approval")
    public VariantResponse approveQuestionVariant(@PathVariable UUID id, @Valid @RequestBody ApprovalRequest req,
            Authentication authentication) {
        return questionService.setQuestionVariantApproval(
                authService.findActiveUser(authentication.getName()), id, req.getApproved());
    }

    @PutMapping("/answer-variants/{id}/approval")
    public VariantResponse approveAnswerVariant(@PathVariable UUID id, @Valid @RequestBody ApprovalRequest req,
            Authentication authentication) {
        return questionService.setAnswerVariantApproval(
                authService.findActiveUser(authentication.getName()), id, req.getApproved());
    }
}
