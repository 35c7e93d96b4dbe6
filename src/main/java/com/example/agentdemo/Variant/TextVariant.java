package com.example.agentdemo.Variant;

/**
 * 생성된 변형 한 건
 * @param text 평문
 * @param html 답변이면 서식 보존 HTML, 질문이면 평문과 동일
 * @param technique 적용한 규칙 이름 (조합이면 combined_a_b)
 * @param confidence 규칙별 고정 신뢰도
 */
public record TextVariant(String text, String html, String technique, double confidence) {
}
