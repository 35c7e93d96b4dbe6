package com.example.agentdemo.Variant;

/**
 * 규칙 하나를 적용한 결과 (평문 + HTML + 신뢰도)
 */
public record ParaphraseResult(String text, String html, double confidence) {

    static ParaphraseResult of(String before, String after, String sourceHtml, double confidence) {
        return new ParaphraseResult(after, substituteHtml(sourceHtml, before, after), confidence);
    }

    /**
     * 원본 HTML 에서 바뀌기 전 평문 구간을 그대로 찾아 새 평문으로 교체
     * 찾지 못하면(태그가 문장 중간에 끼어 있거나 규칙을 연달아 적용한 경우 등) 평문으로 대체
     */
    static String substituteHtml(String html, String before, String after) {
        if (html == null || html.isEmpty() || before.isEmpty()) {
            return after;
        }
        int at = html.indexOf(before);
        if (at < 0) {
            return after;
        }
        return html.substring(0, at) + after + html.substring(at + before.length());
    }
}
