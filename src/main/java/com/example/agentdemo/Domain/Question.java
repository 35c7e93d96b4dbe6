package com.example.agentdemo.Domain;

import com.example.agentdemo.Enum.ContentStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 에이전트에 등록된 질문
 * - 답변(Answer)과 1:1, 상태는 항상 답변과 함께 바뀐다
 * - 변형(QuestionVariant)은 원문이 바뀔 때마다 통째로 다시 생성
 */
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
@Entity
public class Question {

    @Id
    @GeneratedValue
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "agent_id", nullable = false)
    private Agent agent;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String questionText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ContentStatus status = ContentStatus.DRAFT;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by", nullable = false)
    private Users createdBy;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @OneToOne(mappedBy = "question", cascade = CascadeType.ALL, orphanRemoval = true)
    private Answer answer;

    @OneToMany(mappedBy = "question", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("variantOrder ASC")
    private List<QuestionVariant> variants = new ArrayList<>();

    @Builder
    public Question(Agent agent, String questionText, Users createdBy) {
        this.agent = agent;
        this.questionText = questionText;
        this.createdBy = createdBy;
    }

    /**
     * 답변을 생성해 연결 (질문과 같은 상태로 시작)
     */
    public Answer attachAnswer(String answerText, String answerHtml) {
        this.answer = new Answer(this, answerText, answerHtml, createdBy);
        this.answer.syncStatus(status);
        return this.answer;
    }

    public void updateText(String questionText) {
        this.questionText = questionText;
    }

    /**
     * 질문과 답변의 상태를 함께 변경
     * 질문만 Final 이고 답변은 Draft 인 상태가 생기지 않도록 상태 변경은 이 메서드로만 한다.
     */
    public void changeStatus(ContentStatus status) {
        this.status = status;
        if (answer != null) {
            answer.syncStatus(status);
        }
    }

    // 기존 변형은 orphanRemoval 로 삭제되고 새 목록으로 대체됨
    public void replaceVariants(List<String> variantTexts) {
        variants.clear();
        for (int i = 0; i < variantTexts.size(); i++) {
            variants.add(new QuestionVariant(this, variantTexts.get(i), i));
        }
    }

    public boolean isFinal() {
        return status == ContentStatus.FINAL;
    }
}
