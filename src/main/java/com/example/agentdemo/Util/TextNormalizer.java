package com.example.agentdemo.Util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 변형 생성기와 매칭에서 공통으로 쓰는 텍스트 정규화 유틸
 * 1. <...> 형태의 태그 제거 (중첩 태그는 고려하지 않음)
 * 2. 소문자 변환
 * 3. 공백 기준 토큰 분리
 * 4. 길이 2 이하 토큰 제거 (관사/전치사 등 잡음 제거용)
 */
public final class TextNormalizer {

    public static final int MIN_TOKEN_LENGTH = 3;

    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /** 태그만 제거하고 대소문자는 유지 (변형 생성 원문용) */
    public static String stripHtml(String raw) {
        if (raw == null) {
            return "";
        }
        return TAG.matcher(raw).replaceAll("").trim();
    }

    /**
     * 유사도 계산용 토큰 목록
     * @param raw 원문 (HTML 포함 가능, null 허용)
     * @return 소문자 토큰 목록, 빈 입력이면 빈 목록
     */
    public static List<String> normalize(String raw) {
        String stripped = stripHtml(raw).toLowerCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>();
        if (stripped.isEmpty()) {
            return tokens;
        }
        for (String token : WHITESPACE.split(stripped)) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    // 중복 제거된 토큰 집합 (등장 순서 유지)
    public static Set<String> tokenSet(String raw) {
        return new LinkedHashSet<>(normalize(raw));
    }
}
