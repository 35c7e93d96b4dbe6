package com.example.agentdemo.DTO;

import java.util.UUID;

/**
 * 매칭 결과. 폴백 응답이면 questionId/answerId 가 null
 */
public record MatchResult(UUID questionId, UUID answerId, String text, String html, double score) {

    public static MatchResult fallback(String message) {
        return new MatchResult(null, null, message, message, 0);
    }

    public boolean matched() {
        return questionId != null;
    }
}
