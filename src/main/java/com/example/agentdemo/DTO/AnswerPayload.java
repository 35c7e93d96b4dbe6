package com.example.agentdemo.DTO;

// 답변 본문 한 벌 (원본 또는 변형)
public record AnswerPayload(String text, String html) {
}
