package com.example.agentdemo.Service;

import com.example.agentdemo.DTO.ChatExchangeResponse;
import com.example.agentdemo.DTO.ChatMessageDto;
import com.example.agentdemo.DTO.ChatStartResponse;
import com.example.agentdemo.DTO.MatchResult;
import com.example.agentdemo.Domain.Agent;
import com.example.agentdemo.Domain.ChatMessage;
import com.example.agentdemo.Domain.ChatSession;
import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.AgentEnvironment;
import com.example.agentdemo.Enum.MessageType;
import com.example.agentdemo.Repository.ChatMessageRepository;
import com.example.agentdemo.Repository.ChatSessionRepository;
import com.example.agentdemo.Util.CustomException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ChatServiceTest {

    private ChatSessionRepository sessionRepository;
    private ChatMessageRepository messageRepository;
    private AgentService agentService;
    private AnswerMatchService answerMatchService;
    private ChatHistoryCacheService historyCache;
    private ChatService chatService;

    private Users user;
    private Agent agent;

    @BeforeEach
    void setUp() {
        sessionRepository = mock(ChatSessionRepository.class);
        messageRepository = mock(ChatMessageRepository.class);
        agentService = mock(AgentService.class);
        answerMatchService = mock(AnswerMatchService.class);
        historyCache = mock(ChatHistoryCacheService.class);
        chatService = new ChatService(sessionRepository, messageRepository, agentService, answerMatchService, historyCache);

        user = new Users();
        user.setId(7L);
        user.setUserId("demo");
        agent = Agent.builder()
                .name("Support Bot")
                .environment(AgentEnvironment.AGENTFORCE)
                .version("2.1")
                .developedBy("CX team")
                .createdBy(user)
                .build();
    }

    @Test
    void start_endsPreviousSessionAndCountsAccess() {
        UUID agentId = UUID.randomUUID();
        ChatSession previous = new ChatSession(user, agent);
        when(agentService.getFinalAgent(agentId)).thenReturn(agent);
        when(sessionRepository.findByUser_IdAndAgent_IdAndActiveTrue(7L, agentId)).thenReturn(List.of(previous));
        when(sessionRepository.save(any(ChatSession.class))).then(returnsFirstArg());

        ChatStartResponse response = chatService.start(user, agentId);

        assertThat(previous.isActive()).isFalse();
        assertThat(previous.getEndedAt()).isNotNull();
        assertThat(agent.getAccessCount()).isEqualTo(1);
        assertThat(response.agentName()).isEqualTo("Support Bot");
        verify(historyCache).evict(previous.getId());
    }

    @Test
    void start_unknownOrDraftAgentPropagatesNotFound() {
        UUID agentId = UUID.randomUUID();
        when(agentService.getFinalAgent(agentId)).thenThrow(CustomException.notFound("에이전트"));

        assertThatThrownBy(() -> chatService.start(user, agentId)).isInstanceOf(CustomException.class);
        verify(sessionRepository, never()).save(any());
    }

    @Test
    void sendMessage_storesUserThenAgentMessage() {
        UUID sessionId = UUID.randomUUID();
        ChatSession session = new ChatSession(user, agent);
        when(sessionRepository.findByIdAndUser_IdAndActiveTrue(sessionId, 7L)).thenReturn(Optional.of(session));
        when(messageRepository.save(any(ChatMessage.class))).then(returnsFirstArg());
        UUID questionId = UUID.randomUUID();
        UUID answerId = UUID.randomUUID();
        when(answerMatchService.match(any(), eq("what's the return policy")))
                .thenReturn(new MatchResult(questionId, answerId, "30 days.", "<p>30 days.</p>", 0.75));

        ChatExchangeResponse response = chatService.sendMessage(user, sessionId, "  what's the return policy ");

        List<ChatMessageDto> messages = response.messages();
        assertThat(messages).extracting(ChatMessageDto::type).containsExactly(MessageType.USER, MessageType.AGENT);
        assertThat(messages.get(0).text()).isEqualTo("what's the return policy");
        assertThat(messages.get(1).html()).isEqualTo("<p>30 days.</p>");
        assertThat(messages.get(1).questionId()).isEqualTo(questionId);
        assertThat(messages.get(1).answerId()).isEqualTo(answerId);
        assertThat(messages.get(1).timestamp()).isAfter(messages.get(0).timestamp());
        verify(historyCache).append(eq(sessionId), anyList());
    }

    @Test
    void sendMessage_fallbackIsStoredWithoutQuestionReference() {
        UUID sessionId = UUID.randomUUID();
        when(sessionRepository.findByIdAndUser_IdAndActiveTrue(sessionId, 7L))
                .thenReturn(Optional.of(new ChatSession(user, agent)));
        when(messageRepository.save(any(ChatMessage.class))).then(returnsFirstArg());
        when(answerMatchService.match(any(), any()))
                .thenReturn(MatchResult.fallback(AnswerMatchService.NO_MATCH_MESSAGE));

        ChatMessageDto reply = chatService.sendMessage(user, sessionId, "weather?").messages().get(1);

        assertThat(reply.text()).isEqualTo(AnswerMatchService.NO_MATCH_MESSAGE);
        assertThat(reply.questionId()).isNull();
        assertThat(reply.answerId()).isNull();
    }

    @Test
    void sendMessage_toEndedOrForeignSessionIsNotFound() {
        UUID sessionId = UUID.randomUUID();
        when(sessionRepository.findByIdAndUser_IdAndActiveTrue(sessionId, 7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> chatService.sendMessage(user, sessionId, "hello"))
                .isInstanceOf(CustomException.class);
        verifyNoInteractions(answerMatchService, messageRepository);
    }

    @Test
    void end_closesSessionAndEvictsCache() {
        UUID sessionId = UUID.randomUUID();
        ChatSession session = new ChatSession(user, agent);
        when(sessionRepository.findByIdAndUser_Id(sessionId, 7L)).thenReturn(Optional.of(session));

        chatService.end(user, sessionId);

        assertThat(session.isActive()).isFalse();
        verify(historyCache).evict(sessionId);
    }
}
