package com.example.agentdemo.Repository;

import com.example.agentdemo.Domain.Question;
import com.example.agentdemo.Enum.ContentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface QuestionRepository extends JpaRepository<Question, UUID> {

    // 관리자 목록: 답변까지 함께 로드 (변형은 지연 로딩)
    @Query("SELECT q FROM Question q LEFT JOIN FETCH q.answer WHERE q.agent.id = :agentId ORDER BY q.createdAt DESC")
    List<Question> findWithAnswerByAgentId(@Param("agentId") UUID agentId);

    /**
     * 매칭 대상 질문: 에이전트/질문/답변이 모두 지정 상태(Final)인 것만
     * 등록 순서대로 반환 (동점일 때 먼저 본 후보가 이김)
     */
    @Query("SELECT q FROM Question q JOIN FETCH q.answer a JOIN q.agent ag " +
            "WHERE ag.id = :agentId AND ag.status = :status AND q.status = :status AND a.status = :status " +
            "ORDER BY q.createdAt ASC")
    List<Question> findMatchable(@Param("agentId") UUID agentId, @Param("status") ContentStatus status);
}
