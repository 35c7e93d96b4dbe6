package com.example.agentdemo.Service;

import com.example.agentdemo.DTO.MatchableQuestion;
import com.example.agentdemo.DTO.QuestionRequest;
import com.example.agentdemo.DTO.QuestionResponse;
import com.example.agentdemo.Domain.Agent;
import com.example.agentdemo.Domain.AnswerVariant;
import com.example.agentdemo.Domain.Question;
import com.example.agentdemo.Domain.QuestionVariant;
import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.AgentEnvironment;
import com.example.agentdemo.Enum.AuditAction;
import com.example.agentdemo.Enum.ContentStatus;
import com.example.agentdemo.Repository.AgentRepository;
import com.example.agentdemo.Repository.AnswerVariantRepository;
import com.example.agentdemo.Repository.QuestionRepository;
import com.example.agentdemo.Repository.QuestionVariantRepository;
import com.example.agentdemo.Util.CustomException;
import com.example.agentdemo.Variant.TextVariant;
import com.example.agentdemo.Variant.VariantGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class QuestionServiceTest {

    private QuestionRepository questionRepository;
    private QuestionVariantRepository questionVariantRepository;
    private AnswerVariantRepository answerVariantRepository;
    private AgentRepository agentRepository;
    private AuditLogService auditLogService;
    private QuestionService questionService;

    private Users admin;
    private Agent agent;

    @BeforeEach
    void setUp() {
        questionRepository = mock(QuestionRepository.class);
        questionVariantRepository = mock(QuestionVariantRepository.class);
        answerVariantRepository = mock(AnswerVariantRepository.class);
        agentRepository = mock(AgentRepository.class);
        auditLogService = mock(AuditLogService.class);
        questionService = new QuestionService(questionRepository, questionVariantRepository,
                answerVariantRepository, agentRepository, new VariantGenerator(new Random(11)), auditLogService);

        admin = new Users();
        admin.setUserId("admin");
        agent = Agent.builder()
                .name("Support Bot")
                .environment(AgentEnvironment.COPILOT)
                .version("1.0")
                .developedBy("Support team")
                .createdBy(admin)
                .build();
    }

    @Test
    void createQuestion_startsAsDraftWithGeneratedVariants() {
        UUID agentId = UUID.randomUUID();
        when(agentRepository.findById(agentId)).thenReturn(Optional.of(agent));
        when(questionRepository.save(any(Question.class))).then(returnsFirstArg());

        QuestionResponse response = questionService.createQuestion(admin, agentId, new QuestionRequest(
                "How do I reset my password?", "Open settings. Click reset.", "<p>Open settings. Click reset.</p>",
                null));

        assertThat(response.status()).isEqualTo(ContentStatus.DRAFT);
        assertThat(response.answer().status()).isEqualTo(ContentStatus.DRAFT);
        assertThat(response.variants()).extracting(v -> v.text())
                .contains("What is the process to reset my password?");
        assertThat(response.answer().variants())
                .anySatisfy(v -> {
                    assertThat(v.text()).isEqualTo("Click reset. Open settings.");
                    assertThat(v.html()).isEqualTo("<p>Click reset. Open settings.</p>");
                });
        verify(auditLogService).record(eq(admin), eq(AuditAction.CREATE), eq("question"), any(), isNull(), any());
    }

    @Test
    void createQuestion_unknownAgentIsNotFound() {
        UUID agentId = UUID.randomUUID();
        when(agentRepository.findById(agentId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> questionService.createQuestion(admin, agentId,
                new QuestionRequest("q?", "a", "<p>a</p>", null)))
                .isInstanceOf(CustomException.class)
                .extracting(e -> ((CustomException) e).getStatus())
                .isEqualTo(HttpStatus.NOT_FOUND);
        verify(questionRepository, never()).save(any());
    }

    @Test
    void updateQuestion_replacesEveryOldVariantAndResetsToDraft() {
        Question question = finalQuestionWithStaleVariants();
        UUID id = UUID.randomUUID();
        when(questionRepository.findById(id)).thenReturn(Optional.of(question));

        questionService.updateQuestion(admin, id, new QuestionRequest(
                "How do I update my email?", "Go to profile. Edit email.", "<p>Go to profile. Edit email.</p>", null));

        assertThat(question.getQuestionText()).isEqualTo("How do I update my email?");
        assertThat(question.getStatus()).isEqualTo(ContentStatus.DRAFT);
        assertThat(question.getAnswer().getStatus()).isEqualTo(ContentStatus.DRAFT);
        assertThat(question.getVariants()).extracting(QuestionVariant::getVariantText)
                .doesNotContain("stale variant")
                .contains("What is the process to update my email?");
        assertThat(question.getAnswer().getVariants()).extracting(AnswerVariant::getVariantText)
                .doesNotContain("stale answer")
                .contains("Edit email. Go to profile.");
        verify(auditLogService).record(eq(admin), eq(AuditAction.UPDATE), eq("question"), eq(id), any(), any());
    }

    @Test
    void updateQuestion_keepsRequestedStatusOnBothRows() {
        Question question = finalQuestionWithStaleVariants();
        UUID id = UUID.randomUUID();
        when(questionRepository.findById(id)).thenReturn(Optional.of(question));

        questionService.updateQuestion(admin, id, new QuestionRequest(
                "Where is my invoice?", "Under billing.", "<p>Under billing.</p>", ContentStatus.FINAL));

        assertThat(question.getStatus()).isEqualTo(ContentStatus.FINAL);
        assertThat(question.getAnswer().getStatus()).isEqualTo(ContentStatus.FINAL);
    }

    @Test
    void updateStatus_movesQuestionAndAnswerTogether() {
        Question question = Question.builder().agent(agent).questionText("Where is my invoice?").createdBy(admin).build();
        question.attachAnswer("Under billing.", "<p>Under billing.</p>");
        UUID id = UUID.randomUUID();
        when(questionRepository.findById(id)).thenReturn(Optional.of(question));

        questionService.updateStatus(admin, id, ContentStatus.FINAL);

        assertThat(question.getStatus()).isEqualTo(ContentStatus.FINAL);
        assertThat(question.getAnswer().getStatus()).isEqualTo(ContentStatus.FINAL);
        verify(auditLogService).record(eq(admin), eq(AuditAction.UPDATE_STATUS), eq("question"), eq(id), any(), any());
    }

    @Test
    void listMatchCandidates_groupsApprovedVariantsPerQuestion() {
        UUID agentId = UUID.randomUUID();
        Question first = persisted(Question.builder().agent(agent).questionText("Where is my invoice?").createdBy(admin).build(),
                "Under billing.");
        Question second = persisted(Question.builder().agent(agent).questionText("How do I log out?").createdBy(admin).build(),
                "Use the menu.");
        when(questionRepository.findMatchable(agentId, ContentStatus.FINAL)).thenReturn(List.of(first, second));

        QuestionVariant invoiceVariant = mock(QuestionVariant.class);
        when(invoiceVariant.getQuestion()).thenReturn(first);
        when(invoiceVariant.getVariantText()).thenReturn("In what location is my invoice?");
        when(questionVariantRepository.findApprovedByQuestionIds(any())).thenReturn(List.of(invoiceVariant));

        AnswerVariant logoutAnswer = mock(AnswerVariant.class);
        when(logoutAnswer.getAnswer()).thenReturn(second.getAnswer());
        when(logoutAnswer.getVariantText()).thenReturn("Utilize the menu.");
        when(logoutAnswer.getVariantHtml()).thenReturn("<p>Utilize the menu.</p>");
        when(answerVariantRepository.findApprovedByAnswerIds(any())).thenReturn(List.of(logoutAnswer));

        List<MatchableQuestion> candidates = questionService.listMatchCandidates(agentId);

        assertThat(candidates).extracting(MatchableQuestion::questionText)
                .containsExactly("Where is my invoice?", "How do I log out?");
        assertThat(candidates.get(0).questionVariants()).containsExactly("In what location is my invoice?");
        assertThat(candidates.get(0).answerVariants()).isEmpty();
        assertThat(candidates.get(1).questionVariants()).isEmpty();
        assertThat(candidates.get(1).answerVariants()).singleElement()
                .satisfies(a -> assertThat(a.html()).isEqualTo("<p>Utilize the menu.</p>"));
    }

    @Test
    void listMatchCandidates_emptyWhenNothingIsFinal() {
        UUID agentId = UUID.randomUUID();
        when(questionRepository.findMatchable(agentId, ContentStatus.FINAL)).thenReturn(List.of());

        assertThat(questionService.listMatchCandidates(agentId)).isEmpty();
        verifyNoInteractions(questionVariantRepository, answerVariantRepository);
    }

    private Question finalQuestionWithStaleVariants() {
        Question question = Question.builder().agent(agent).questionText("Old question?").createdBy(admin).build();
        question.attachAnswer("Old answer.", "<p>Old answer.</p>");
        question.replaceVariants(List.of("stale variant"));
        question.getAnswer().replaceVariants(List.of(new TextVariant("stale answer", "stale answer", "manual", 0.5)));
        question.changeStatus(ContentStatus.FINAL);
        return question;
    }

    private static Question persisted(Question question, String answerText) {
        question.attachAnswer(answerText, "<p>" + answerText + "</p>");
        question.changeStatus(ContentStatus.FINAL);
        ReflectionTestUtils.setField(question, "id", UUID.randomUUID());
        ReflectionTestUtils.setField(question.getAnswer(), "id", UUID.randomUUID());
        return question;
    }
}
