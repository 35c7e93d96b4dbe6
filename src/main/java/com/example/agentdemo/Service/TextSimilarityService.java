package com.example.agentdemo.Service;

import com.example.agentdemo.Util.TextNormalizer;
import org.springframework.stereotype.Service;

import java.util.Set;

@Service
public class TextSimilarityService {

    /**
     * 단어 겹침 기반 유사도 (0 ~ 1)
     * - 양쪽 모두 정규화 후 길이 3 이상 토큰만 사용
     * - 사용자 토큰마다 후보 토큰 중 하나라도 서로 포함 관계(부분 문자열)이면 일치로 센다
     *   (어간/복수형 정도는 별도 처리 없이 잡힘)
     * - 일치 수 / max(사용자 토큰 수, 후보 토큰 수)
     * 대칭이 아니므로 거리 값이 아니라 순위용 점수로만 사용
     * @param utterance 사용자 입력
     * @param candidateText 질문 또는 질문 변형
     * @return 유사도, 어느 한쪽 토큰이 비어 있으면 0
     */
    public double score(String utterance, String candidateText) {
        Set<String> userTokens = TextNormalizer.tokenSet(utterance);
        Set<String> candidateTokens = TextNormalizer.tokenSet(candidateText);
        if (userTokens.isEmpty() || candidateTokens.isEmpty()) {
            return 0;
        }

        int matches = 0;
        for (String token : userTokens) {
            for (String other : candidateTokens) {
                if (token.contains(other) || other.contains(token)) {
                    matches++;
                    break;
                }
            }
        }
        return (double) matches / Math.max(userTokens.size(), candidateTokens.size());
    }
}
