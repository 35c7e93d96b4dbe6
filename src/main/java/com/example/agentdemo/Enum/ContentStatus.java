package com.example.agentdemo.Enum;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 게시 상태 (Agent / Question / Answer 공통)
 * - Draft: 관리자만 볼 수 있음
 * - Final: 데모 사용자에게 노출, 매칭 대상
 */
public enum ContentStatus {
    DRAFT("Draft"),
    FINAL("Final");

    private final String label;

    ContentStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static ContentStatus from(String value) {
        for (ContentStatus s : values()) {
            if (s.label.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Status must be Draft or Final: " + value);
    }
}
