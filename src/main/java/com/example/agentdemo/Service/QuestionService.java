package com.example.agentdemo.Service;

import com.example.agentdemo.DTO.AnswerPayload;
import com.example.agentdemo.DTO.MatchableQuestion;
import com.example.agentdemo.DTO.QuestionRequest;
import com.example.agentdemo.DTO.QuestionResponse;
import com.example.agentdemo.DTO.VariantResponse;
import com.example.agentdemo.Domain.Agent;
import com.example.agentdemo.Domain.Answer;
import com.example.agentdemo.Domain.AnswerVariant;
import com.example.agentdemo.Domain.Question;
import com.example.agentdemo.Domain.QuestionVariant;
import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.AuditAction;
import com.example.agentdemo.Enum.ContentStatus;
import com.example.agentdemo.Enum.VariantKind;
import com.example.agentdemo.Repository.AgentRepository;
import com.example.agentdemo.Repository.AnswerVariantRepository;
import com.example.agentdemo.Repository.QuestionRepository;
import com.example.agentdemo.Repository.QuestionVariantRepository;
import com.example.agentdemo.Util.CustomException;
import com.example.agentdemo.Variant.TextVariant;
import com.example.agentdemo.Variant.VariantGenerator;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 질문/답변 관리
 * - 원문이 저장될 때마다 질문/답변 변형을 다시 생성 (같은 트랜잭션)
 * - 질문과 답변의 상태는 항상 함께 바뀐다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionService {

    private static final String ENTITY_TYPE = "question";

    private final QuestionRepository questionRepository;
    private final QuestionVariantRepository questionVariantRepository;
    private final AnswerVariantRepository answerVariantRepository;
    private final AgentRepository agentRepository;
    private final VariantGenerator variantGenerator;
    private final AuditLogService auditLogService;

    @Transactional
    public List<QuestionResponse> listForAgent(UUID agentId) {
        if (!agentRepository.existsById(agentId)) {
            throw CustomException.notFound("에이전트");
        }
        return questionRepository.findWithAnswerByAgentId(agentId).stream()
                .map(QuestionResponse::fromEntity)
                .toList();
    }

    @Transactional
    public QuestionResponse createQuestion(Users actor, UUID agentId, QuestionRequest req) {
        Agent agent = agentRepository.findById(agentId)
                .orElseThrow(() -> CustomException.notFound("에이전트"));

        Question question = Question.builder()
                .agent(agent)
                .questionText(req.getQuestionText().trim())
                .createdBy(actor)
                .build();
        // 새 질문/답변은 항상 Draft 로 시작
        question.attachAnswer(req.getAnswerText().trim(), req.getAnswerHtml());
        regenerateVariants(question);

        Question saved = questionRepository.save(question);
        auditLogService.record(actor, AuditAction.CREATE, ENTITY_TYPE, saved.getId(), null, snapshot(saved));
        log.info("질문 생성: agentId={}, questionId={}, variants={}/{}", agentId, saved.getId(),
                saved.getVariants().size(), saved.getAnswer().getVariants().size());
        return QuestionResponse.fromEntity(saved);
    }

    /**
     * 질문/답변 수정
     * 상태를 지정하지 않으면 Draft 로 되돌린다 (수정된 내용은 다시 검토 후 Final 전환)
     */
    @Transactional
    public QuestionResponse updateQuestion(Users actor, UUID questionId, QuestionRequest req) {
        Question question = findQuestion(questionId);
        QuestionSnapshot before = snapshot(question);

        question.updateText(req.getQuestionText().trim());
        question.getAnswer().updateContent(req.getAnswerText().trim(), req.getAnswerHtml());
        question.changeStatus(req.getStatus() != null ? req.getStatus() : ContentStatus.DRAFT);
        regenerateVariants(question);

        auditLogService.record(actor, AuditAction.UPDATE, ENTITY_TYPE, questionId, before, snapshot(question));
        log.info("질문 수정: questionId={}, status={}", questionId, question.getStatus());
        return QuestionResponse.fromEntity(question);
    }

    @Transactional
    public void deleteQuestion(Users actor, UUID questionId) {
        Question question = findQuestion(questionId);
        QuestionSnapshot before = snapshot(question);
        questionRepository.delete(question);
        auditLogService.record(actor, AuditAction.DELETE, ENTITY_TYPE, questionId, before, null);
        log.info("질문 삭제: questionId={}", questionId);
    }

    @Transactional
    public QuestionResponse updateStatus(Users actor, UUID questionId, ContentStatus status) {
        Question question = findQuestion(questionId);
        ContentStatus old = question.getStatus();
        question.changeStatus(status);
        auditLogService.record(actor, AuditAction.UPDATE_STATUS, ENTITY_TYPE, questionId,
                Map.of("status", old), Map.of("status", status));
        log.info("질문 상태 변경: questionId={}, {} -> {}", questionId, old, status);
        return QuestionResponse.fromEntity(question);
    }

    @Transactional
    public VariantResponse setQuestionVariantApproval(Users actor, UUID variantId, boolean approved) {
        QuestionVariant variant = questionVariantRepository.findById(variantId)
                .orElseThrow(() -> CustomException.notFound("질문 변형"));
        boolean old = variant.isApproved();
        variant.changeApproval(approved);
        auditLogService.record(actor, AuditAction.UPDATE_APPROVAL, "question_variant", variantId,
                Map.of("approved", old), Map.of("approved", approved));
        return VariantResponse.fromEntity(variant);
    }

    @Transactional
    public VariantResponse setAnswerVariantApproval(Users actor, UUID variantId, boolean approved) {
        AnswerVariant variant = answerVariantRepository.findById(variantId)
                .orElseThrow(() -> CustomException.notFound("답변 변형"));
        boolean old = variant.isApproved();
        variant.changeApproval(approved);
        auditLogService.record(actor, AuditAction.UPDATE_APPROVAL, "answer_variant", variantId,
                Map.of("approved", old), Map.of("approved", approved));
        return VariantResponse.fromEntity(variant);
    }

    /**
     * 매칭 후보 로드
     * Final 에이전트의 Final 질문/답변만, 변형은 승인된 것만 포함
     * 질문은 등록순, 변형은 생성순
     * 별도 트랜잭션으로 조회: 조회 실패가 호출 측(채팅) 트랜잭션을 rollback-only 로 만들지 않도록
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public List<MatchableQuestion> listMatchCandidates(UUID agentId) {
        List<Question> questions = questionRepository.findMatchable(agentId, ContentStatus.FINAL);
        if (questions.isEmpty()) {
            return List.of();
        }

        List<UUID> questionIds = questions.stream().map(Question::getId).toList();
        List<UUID> answerIds = questions.stream().map(q -> q.getAnswer().getId()).toList();

        Map<UUID, List<String>> questionVariants = questionVariantRepository.findApprovedByQuestionIds(questionIds)
                .stream()
                .collect(Collectors.groupingBy(v -> v.getQuestion().getId(),
                        Collectors.mapping(QuestionVariant::getVariantText, Collectors.toList())));
        Map<UUID, List<AnswerPayload>> answerVariants = answerVariantRepository.findApprovedByAnswerIds(answerIds)
                .stream()
                .collect(Collectors.groupingBy(v -> v.getAnswer().getId(),
                        Collectors.mapping(v -> new AnswerPayload(v.getVariantText(), v.getVariantHtml()),
                                Collectors.toList())));

        return questions.stream()
                .map(q -> {
                    Answer a = q.getAnswer();
                    return new MatchableQuestion(
                            q.getId(),
                            a.getId(),
                            q.getQuestionText(),
                            new AnswerPayload(a.getAnswerText(), a.getAnswerHtml()),
                            questionVariants.getOrDefault(q.getId(), List.of()),
                            answerVariants.getOrDefault(a.getId(), List.of()));
                })
                .toList();
    }

    // 변형 생성이 실패해도 빈 목록이 돌아오므로 저장은 계속 진행된다
    private void regenerateVariants(Question question) {
        List<TextVariant> questionVariants =
                variantGenerator.generateVariants(question.getQuestionText(), VariantKind.QUESTION);
        question.replaceVariants(questionVariants.stream().map(TextVariant::text).toList());

        Answer answer = question.getAnswer();
        answer.replaceVariants(
                variantGenerator.generateVariants(answer.getAnswerText(), VariantKind.ANSWER, answer.getAnswerHtml()));
    }

    private Question findQuestion(UUID questionId) {
        return questionRepository.findById(questionId)
                .orElseThrow(() -> CustomException.notFound("질문"));
    }

    private static QuestionSnapshot snapshot(Question q) {
        Answer a = q.getAnswer();
        return new QuestionSnapshot(q.getQuestionText(), a != null ? a.getAnswerText() : null, q.getStatus());
    }

    // 감사 로그에 남기는 변경 전/후 값
    record QuestionSnapshot(String questionText, String answerText, ContentStatus status) {
    }
}
