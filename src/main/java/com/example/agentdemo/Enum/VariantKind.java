package com.example.agentdemo.Enum;

/**
 * 변형 생성 대상 종류
 * - QUESTION: 질문 문장 (구조 재배치/문맥 추가 등 질문 전용 규칙 적용)
 * - ANSWER: 답변 본문 (HTML 서식 보존 대상)
 */
public enum VariantKind {
    QUESTION,
    ANSWER
}
