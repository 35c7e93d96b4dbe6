package com.example.agentdemo.Service;

import com.example.agentdemo.DTO.AnswerPayload;
import com.example.agentdemo.DTO.MatchResult;
import com.example.agentdemo.DTO.MatchableQuestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * 사용자 메시지에 가장 가까운 질문을 찾아 답변을 돌려준다.
 *
 * 1. 에이전트의 매칭 대상 질문(Final) + 승인된 변형 로드
 * 2. 원문/변형 각각 점수 계산, 더 큰 점수가 나올 때만 최고 후보 교체 (동점이면 먼저 본 후보 유지)
 * 3. 변형으로 이긴 경우 승인된 답변 변형 중 하나를 무작위로 골라 응답
 * 4. 최고 점수가 0.3 이하이면 "정보 없음" 폴백
 * 어떤 예외도 밖으로 던지지 않고 "기술적 문제" 폴백으로 바꾼다.
 */
@Slf4j
@Service
public class AnswerMatchService {

    static final double MATCH_THRESHOLD = 0.3;

    public static final String NO_MATCH_MESSAGE =
            "I'm sorry, I don't have information about that topic. Could you please rephrase your question or ask about something else?";
    public static final String ERROR_MESSAGE =
            "I'm experiencing technical difficulties. Please try again later.";

    private final QuestionService questionService;
    private final TextSimilarityService similarityService;
    private final Random random;

    public AnswerMatchService(QuestionService questionService,
            TextSimilarityService similarityService,
            @Qualifier("variantRandom") Random random) {
        this.questionService = questionService;
        this.similarityService = similarityService;
        this.random = random;
    }

    public MatchResult match(UUID agentId, String utterance) {
        try {
            List<MatchableQuestion> questions = questionService.listMatchCandidates(agentId);

            MatchCandidate best = null;
            double bestScore = 0;
            for (MatchCandidate candidate : flatten(questions)) {
                double score = similarityService.score(utterance, candidate.text());
                if (score > bestScore) {
                    best = candidate;
                    bestScore = score;
                }
            }

            if (best == null || bestScore <= MATCH_THRESHOLD) {
                log.info("매칭 실패 → 폴백 응답: agentId={}, bestScore={}", agentId, bestScore);
                return MatchResult.fallback(NO_MATCH_MESSAGE);
            }

            AnswerPayload answer = resolveAnswer(best);
            log.info("매칭 성공: agentId={}, questionId={}, score={}, viaVariant={}",
                    agentId, best.question().questionId(), bestScore, best.variant());
            return new MatchResult(best.question().questionId(), best.question().answerId(),
                    answer.text(), answer.html(), bestScore);
        } catch (Exception e) {
            log.error("답변 매칭 중 오류: agentId={}", agentId, e);
            return MatchResult.fallback(ERROR_MESSAGE);
        }
    }

    // 질문 원문 다음에 그 질문의 변형들이 오는 순서로 후보를 펼친다
    private static List<MatchCandidate> flatten(List<MatchableQuestion> questions) {
        List<MatchCandidate> candidates = new ArrayList<>();
        for (MatchableQuestion q : questions) {
            candidates.add(new MatchCandidate(q, q.questionText(), false));
            for (String variantText : q.questionVariants()) {
                candidates.add(new MatchCandidate(q, variantText, true));
            }
        }
        return candidates;
    }

    private AnswerPayload resolveAnswer(MatchCandidate winner) {
        List<AnswerPayload> answerVariants = winner.question().answerVariants();
        if (winner.variant() && !answerVariants.isEmpty()) {
            return answerVariants.get(random.nextInt(answerVariants.size()));
        }
        return winner.question().answer();
    }

    /**
     * 점수 계산 단위 (질문 원문 또는 변형 하나)
     */
    record MatchCandidate(MatchableQuestion question, String text, boolean variant) {
    }
}
