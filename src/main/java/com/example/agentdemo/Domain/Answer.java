package com.example.agentdemo.Domain;

import com.example.agentdemo.Enum.ContentStatus;
import com.example.agentdemo.Variant.TextVariant;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 질문에 딸린 답변 (평문 + 서식 HTML)
 * 생성/상태 변경은 Question 을 통해서만 한다.
 */
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
@Entity
public class Answer {

    @Id
    @GeneratedValue
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "question_id", nullable = false, unique = true)
    private Question question;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String answerText;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String answerHtml;

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

    @OneToMany(mappedBy = "answer", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("variantOrder ASC")
    private List<AnswerVariant> variants = new ArrayList<>();

    Answer(Question question, String answerText, String answerHtml, Users createdBy) {
        this.question = question;
        this.answerText = answerText;
        this.answerHtml = answerHtml;
        this.createdBy = createdBy;
    }

    public void updateContent(String answerText, String answerHtml) {
        this.answerText = answerText;
        this.answerHtml = answerHtml;
    }

    void syncStatus(ContentStatus status) {
        this.status = status;
    }

    public void replaceVariants(List<TextVariant> generated) {
        variants.clear();
        for (int i = 0; i < generated.size(); i++) {
            TextVariant v = generated.get(i);
            variants.add(new AnswerVariant(this, v.text(), v.html(), i));
        }
    }
}
