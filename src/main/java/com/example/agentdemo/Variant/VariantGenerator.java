package com.example.agentdemo.Variant;

import com.example.agentdemo.Enum.VariantKind;
import com.example.agentdemo.Util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.example.agentdemo.Variant.ParaphraseTechnique.*;

/**
 * 질문/답변 한 건으로부터 바꿔 말한 변형 목록을 만든다.
 *
 * 1차: 규칙 목록을 하나씩 원문에 적용
 * 2차: 정해진 규칙 쌍을 이어서 적용 (creative variants)
 * 결과는 텍스트 기준 중복 제거, 원문과 같은 결과 제외, 생성 순서대로 최대 12개.
 *
 * 확률 게이트가 있는 규칙이 있어서 같은 입력이라도 호출마다 결과가 달라질 수 있다.
 */
@Slf4j
@Component
public class VariantGenerator {

    public static final int MAX_VARIANTS = 12;
    private static final double CREATIVE_CONFIDENCE = 0.7;

    private static final List<List<ParaphraseTechnique>> CREATIVE_PAIRS = List.of(
            List.of(SYNONYM_REPLACEMENT, FORMAL_INFORMAL),
            List.of(SENTENCE_RESTRUCTURING, EXPAND_CONTRACT),
            List.of(QUESTION_STYLE, EMPHASIS_SHIFT),
            List.of(CONTEXTUAL_VARIATION, SYNONYM_REPLACEMENT));

    private final Random random;

    public VariantGenerator(@Qualifier("variantRandom") Random random) {
        this.random = random;
    }

    public List<TextVariant> generateVariants(String sourceText, VariantKind kind) {
        return generateVariants(sourceText, kind, null);
    }

    /**
     * @param sourceText 원문 평문
     * @param kind 질문/답변
     * @param sourceHtml 답변 HTML (질문이면 null)
     * @return 변형 목록, 실패 시 빈 목록 (질문/답변 저장을 막지 않기 위해 예외를 밖으로 내보내지 않음)
     */
    public List<TextVariant> generateVariants(String sourceText, VariantKind kind, String sourceHtml) {
        if (sourceText == null || sourceText.isBlank()) {
            return List.of();
        }
        try {
            String source = TextNormalizer.stripHtml(sourceText);
            Map<String, TextVariant> unique = new LinkedHashMap<>();

            for (ParaphraseTechnique technique : ParaphraseTechnique.values()) {
                technique.apply(source, kind, sourceHtml, random).ifPresent(r ->
                        collect(unique, sourceText, source,
                                new TextVariant(r.text(), htmlOf(r), technique.label(), r.confidence())));
            }

            for (List<ParaphraseTechnique> pair : CREATIVE_PAIRS) {
                ParaphraseResult current = new ParaphraseResult(source, sourceHtml, CREATIVE_CONFIDENCE);
                for (ParaphraseTechnique technique : pair) {
                    current = technique.apply(current.text(), kind, current.html(), random).orElse(current);
                }
                collect(unique, sourceText, source,
                        new TextVariant(current.text(), htmlOf(current), combinedLabel(pair), CREATIVE_CONFIDENCE));
            }

            List<TextVariant> variants = unique.values().stream().limit(MAX_VARIANTS).toList();
            log.debug("변형 생성 완료: kind={}, count={}", kind, variants.size());
            return variants;
        } catch (RuntimeException e) {
            log.error("변형 생성 실패, 빈 목록 반환: kind={}, source={}", kind, sourceText, e);
            return List.of();
        }
    }

    private static void collect(Map<String, TextVariant> unique, String rawSource, String source, TextVariant variant) {
        String text = variant.text().trim();
        if (text.isEmpty() || text.equals(source) || text.equals(rawSource.trim())) {
            return;
        }
        unique.putIfAbsent(text, variant);
    }

    private static String htmlOf(ParaphraseResult result) {
        return result.html() != null ? result.html() : result.text();
    }

    private static String combinedLabel(List<ParaphraseTechnique> pair) {
        StringBuilder sb = new StringBuilder("combined");
        for (ParaphraseTechnique technique : pair) {
            sb.append('_').append(technique.label());
        }
        return sb.toString();
    }
}
