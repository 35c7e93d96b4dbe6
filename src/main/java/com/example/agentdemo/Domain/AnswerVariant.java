package com.example.agentdemo.Domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
@Entity
@Table(name = "answer_variants")
public class AnswerVariant {

    @Id
    @GeneratedValue
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "answer_id", nullable = false)
    private Answer answer;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String variantText;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String variantHtml;

    @Column(name = "is_approved", nullable = false)
    private boolean approved = true;

    private int variantOrder;

    AnswerVariant(Answer answer, String variantText, String variantHtml, int variantOrder) {
        this.answer = answer;
        this.variantText = variantText;
        this.variantHtml = variantHtml;
        this.variantOrder = variantOrder;
    }

    public void changeApproval(boolean approved) {
        this.approved = approved;
    }
}
