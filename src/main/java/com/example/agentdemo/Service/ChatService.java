package com.example.agentdemo.Service;

import com.example.agentdemo.DTO.ChatExchangeResponse;
import com.example.agentdemo.DTO.ChatMessageDto;
import com.example.agentdemo.DTO.ChatSessionSummary;
import com.example.agentdemo.DTO.ChatStartResponse;
import com.example.agentdemo.DTO.MatchResult;
import com.example.agentdemo.Domain.Agent;
import com.example.agentdemo.Domain.ChatMessage;
import com.example.agentdemo.Domain.ChatSession;
import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.MessageType;
import com.example.agentdemo.Repository.ChatMessageRepository;
import com.example.agentdemo.Repository.ChatSessionRepository;
import com.example.agentdemo.Util.CustomException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 데모 채팅 세션/메시지 처리
 * 답변 선택은 AnswerMatchService 에 맡기고 여기서는 세션, 기록, 접근 횟수만 관리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    private final ChatSessionRepository sessionRepository;
    private final ChatMessageRepository messageRepository;
    private final AgentService agentService;
    private final AnswerMatchService answerMatchService;
    private final ChatHistoryCacheService historyCache;

    /**
     * 새 세션 시작
     * 같은 에이전트와의 기존 활성 세션은 종료하고 에이전트 접근 횟수를 1 올린다.
     */
    @Transactional
    public ChatStartResponse start(Users user, UUID agentId) {
        Agent agent = agentService.getFinalAgent(agentId);

        for (ChatSession previous : sessionRepository.findByUser_IdAndAgent_IdAndActiveTrue(user.getId(), agentId)) {
            previous.end();
            historyCache.evict(previous.getId());
        }

        ChatSession session = sessionRepository.save(new ChatSession(user, agent));
        agent.increaseAccessCount();
        log.info("채팅 시작: user={}, agentId={}, sessionId={}", user.getUserId(), agentId, session.getId());
        return new ChatStartResponse(session.getId(), agent.getId(), agent.getName());
    }

    @Transactional
    public ChatExchangeResponse sendMessage(Users user, UUID sessionId, String text) {
        ChatSession session = sessionRepository.findByIdAndUser_IdAndActiveTrue(sessionId, user.getId())
                .orElseThrow(() -> CustomException.notFound("활성 채팅 세션"));
        String message = text.trim();

        LocalDateTime userAt = LocalDateTime.now();
        ChatMessage userMessage = messageRepository.save(ChatMessage.builder()
                .session(session)
                .messageType(MessageType.USER)
                .messageText(message)
                .sentAt(userAt)
                .build());

        MatchResult result = answerMatchService.match(session.getAgent().getId(), message);

        // 에이전트 응답은 항상 사용자 메시지 뒤에 정렬되도록
        LocalDateTime agentAt = LocalDateTime.now();
        if (!agentAt.isAfter(userAt)) {
            agentAt = userAt.plusNanos(1000);
        }
        ChatMessage agentMessage = messageRepository.save(ChatMessage.builder()
                .session(session)
                .messageType(MessageType.AGENT)
                .messageText(result.text())
                .messageHtml(result.html())
                .questionId(result.questionId())
                .answerId(result.answerId())
                .sentAt(agentAt)
                .build());

        List<ChatMessageDto> exchange = List.of(
                ChatMessageDto.fromEntity(userMessage),
                ChatMessageDto.fromEntity(agentMessage));
        historyCache.append(sessionId, exchange);
        return new ChatExchangeResponse(exchange);
    }

    // 최근 10건, 시간순
    @Transactional
    public List<ChatMessageDto> history(Users user, UUID sessionId) {
        sessionRepository.findByIdAndUser_Id(sessionId, user.getId())
                .orElseThrow(() -> CustomException.notFound("채팅 세션"));
        return historyCache.recent(sessionId, () -> loadRecent(sessionId));
    }

    @Transactional
    public void end(Users user, UUID sessionId) {
        ChatSession session = sessionRepository.findByIdAndUser_Id(sessionId, user.getId())
                .orElseThrow(() -> CustomException.notFound("채팅 세션"));
        if (session.isActive()) {
            session.end();
            log.info("채팅 종료: user={}, sessionId={}", user.getUserId(), sessionId);
        }
        historyCache.evict(sessionId);
    }

    @Transactional
    public List<ChatSessionSummary> recentSessions(Users user) {
        return sessionRepository.findTop20ByUser_IdOrderByStartedAtDesc(user.getId()).stream()
                .map(ChatSessionSummary::fromEntity)
                .toList();
    }

    private List<ChatMessageDto> loadRecent(UUID sessionId) {
        List<ChatMessageDto> messages = new ArrayList<>(
                messageRepository.findTop10BySession_IdOrderBySentAtDesc(sessionId).stream()
                        .map(ChatMessageDto::fromEntity)
                        .toList());
        Collections.reverse(messages);
        return messages;
    }
}
