package com.example.agentdemo.Variant;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 단어 경계 기준 치환표
 * - 키는 소문자, 대소문자 구분 없이 매칭
 * - 한 번의 스캔으로 치환하므로 치환 결과가 다시 다른 키에 걸리지 않음
 * - 축약형 일부("I'm" 의 I)는 매칭하지 않음
 */
final class WordSwap {

    private final Map<String, String> table;
    private final Pattern pattern;

    private WordSwap(Map<String, String> table) {
        this.table = table;
        // 긴 구문 우선 ("prior to" 가 "to" 보다 먼저 매칭되도록)
        String alternation = table.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.pattern = Pattern.compile("(?<!')\\b(" + alternation + ")\\b(?!')", Pattern.CASE_INSENSITIVE);
    }

    /** "from", "to", "from", "to" ... 순서의 쌍으로 생성, 선언 순서 유지 */
    static WordSwap of(String... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("pairs must be even: " + pairs.length);
        }
        Map<String, String> ordered = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            ordered.put(pairs[i].toLowerCase(Locale.ROOT), pairs[i + 1]);
        }
        return new WordSwap(Collections.unmodifiableMap(ordered));
    }

    WordSwap reversed() {
        Map<String, String> inverse = new LinkedHashMap<>();
        table.forEach((from, to) -> inverse.put(to.toLowerCase(Locale.ROOT), from));
        return new WordSwap(Collections.unmodifiableMap(inverse));
    }

    String apply(String text) {
        return apply(text, table.keySet());
    }

    /**
     * enabled 에 포함된 키만 치환
     */
    String apply(String text, Set<String> enabled) {
        if (enabled.isEmpty()) {
            return text;
        }
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String found = m.group(1);
            String key = found.toLowerCase(Locale.ROOT);
            String replacement = found;
            if (enabled.contains(key)) {
                replacement = atSentenceStart(text, m.start()) ? capitalize(table.get(key)) : table.get(key);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * 키마다 독립적으로 확률 게이트를 통과시킴 (threshold 보다 큰 난수가 나오면 활성)
     */
    Set<String> pick(Random random, double threshold) {
        Set<String> enabled = new LinkedHashSet<>();
        for (String key : table.keySet()) {
            if (random.nextDouble() > threshold) {
                enabled.add(key);
            }
        }
        return enabled;
    }

    static String capitalize(String s) {
        if (s.isEmpty()) {
            return s;
        }
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static boolean atSentenceStart(String text, int index) {
        for (int i = index - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            return c == '.' || c == '?' || c == '!';
        }
        return true;
    }
}
