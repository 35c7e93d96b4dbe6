package com.example.agentdemo.Domain;

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
 * 에이전트를 묶는 도메인(분류)
 */
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
@Entity
@Table(name = "domains")
public class AgentDomain {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    private boolean active = true;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by", nullable = false)
    private Users createdBy;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @OneToMany(mappedBy = "domain")
    @OrderBy("name ASC")
    private List<Agent> agents = new ArrayList<>();

    @Builder
    public AgentDomain(String name, String description, Users createdBy) {
        this.name = name;
        this.description = description;
        this.createdBy = createdBy;
    }

    public void update(String name, String description, Boolean active) {
        this.name = name;
        this.description = description;
        if (active != null) {
            this.active = active;
        }
    }
}
