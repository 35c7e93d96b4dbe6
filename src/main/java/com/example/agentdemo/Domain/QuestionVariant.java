package com.example.agentdemo.Domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * 자동 생성된 질문 변형
 * 승인 해제(approved=false)된 변형은 삭제하지 않고 매칭 조회 시 제외한다.
 */
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
@Entity
@Table(name = "question_variants")
public class QuestionVariant {

    @Id
    @GeneratedValue
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "question_id", nullable = false)
    private Question question;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String variantText;

    @Column(name = "is_approved", nullable = false)
    private boolean approved = true;

    // 생성 순서
    private int variantOrder;

    QuestionVariant(Question question, String variantText, int variantOrder) {
        this.question = question;
        this.variantText = variantText;
        this.variantOrder = variantOrder;
    }

    public void changeApproval(boolean approved) {
        this.approved = approved;
    }
}
