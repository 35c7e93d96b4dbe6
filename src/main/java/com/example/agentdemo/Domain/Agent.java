package com.example.agentdemo.Domain;

import com.example.agentdemo.Enum.AgentEnvironment;
import com.example.agentdemo.Enum.ContentStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 데모 대상 에이전트
 * - 질문/답변, 채팅 세션은 에이전트 삭제 시 함께 삭제
 */
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
@Entity
public class Agent {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AgentEnvironment environment;

    @Column(nullable = false)
    private String version;

    @Column(nullable = false)
    private LocalDateTime lastUpdated;

    private int accessCount;

    @Column(nullable = false)
    private String developedBy;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ContentStatus status = ContentStatus.DRAFT;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "domain_id", nullable = false)
    private AgentDomain domain;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by", nullable = false)
    private Users createdBy;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "agent", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<Question> questions = new ArrayList<>();

    @OneToMany(mappedBy = "agent", cascade = CascadeType.REMOVE)
    private List<ChatSession> chatSessions = new ArrayList<>();

    @Builder
    public Agent(String name, AgentEnvironment environment, String version, String developedBy,
            String description, AgentDomain domain, Users createdBy) {
        this.name = name;
        this.environment = environment;
        this.version = version;
        this.developedBy = developedBy;
        this.description = description;
        this.domain = domain;
        this.createdBy = createdBy;
        this.lastUpdated = LocalDateTime.now();
    }

    public void update(String name, AgentEnvironment environment, String version, String developedBy,
            String description, AgentDomain domain) {
        this.name = name;
        this.environment = environment;
        this.version = version;
        this.developedBy = developedBy;
        this.description = description;
        this.domain = domain;
        this.lastUpdated = LocalDateTime.now();
    }

    public void changeStatus(ContentStatus status) {
        this.status = status;
        this.lastUpdated = LocalDateTime.now();
    }

    public void increaseAccessCount() {
        this.accessCount++;
    }

    public boolean isFinal() {
        return status == ContentStatus.FINAL;
    }
}
