package com.example.agentdemo.Variant;

import java.util.List;

/**
 * 변형 규칙이 참조하는 고정 사전
 * 프로세스 시작 시 한 번 만들어지고 이후 읽기 전용
 */
final class Lexicon {

    private Lexicon() {
    }

    static final WordSwap SYNONYMS = WordSwap.of(
            // 일반 단어
            "how", "in what way",
            "what", "which",
            "why", "for what reason",
            "when", "at what time",
            "where", "in which location",
            "can", "is it possible to",
            "will", "shall",
            "would", "could",
            "should", "ought to",
            "help", "assist",
            "show", "display",
            "explain", "describe",
            "tell", "inform",
            "find", "locate",
            "get", "obtain",
            "make", "create",
            "use", "utilize",
            "need", "require",
            "want", "desire",
            // 기술 용어
            "process", "procedure",
            "method", "approach",
            "system", "platform",
            "feature", "functionality",
            "option", "choice",
            "setting", "configuration",
            "data", "information",
            "user", "person",
            "admin", "administrator",
            "manage", "handle");

    static final WordSwap FORMAL_TO_INFORMAL = WordSwap.of(
            "utilize", "use",
            "commence", "start",
            "terminate", "end",
            "facilitate", "help",
            "endeavor", "try",
            "accomplish", "do",
            "subsequently", "then",
            "prior to", "before",
            "in order to", "to");

    static final WordSwap INFORMAL_TO_FORMAL = WordSwap.of(
            "use", "utilize",
            "start", "commence",
            "end", "terminate",
            "help", "facilitate",
            "try", "endeavor",
            "do", "accomplish",
            "then", "subsequently",
            "before", "prior to",
            "to", "in order to");

    static final WordSwap EXPAND_CONTRACTIONS = WordSwap.of(
            "can't", "cannot",
            "won't", "will not",
            "don't", "do not",
            "doesn't", "does not",
            "isn't", "is not",
            "aren't", "are not",
            "wasn't", "was not",
            "weren't", "were not",
            "haven't", "have not",
            "hasn't", "has not",
            "shouldn't", "should not",
            "wouldn't", "would not",
            "couldn't", "could not");

    static final WordSwap CONTRACT_PHRASES = EXPAND_CONTRACTIONS.reversed();

    static final WordSwap PERSPECTIVE = WordSwap.of(
            "I", "you",
            "me", "you",
            "my", "your",
            "mine", "yours",
            "you", "one",
            "your", "one's",
            "yours", "one's");

    static final List<String> EMPHASIS_WORDS = List.of(
            "particularly", "specifically", "especially", "exactly", "precisely");

    static final List<String> QUESTION_STARTERS = List.of(
            "Could you please explain",
            "I would like to know",
            "Can you help me understand",
            "I need information about",
            "Please tell me");

    static final List<String> CONTEXTS = List.of(
            "In this system,",
            "For this application,",
            "When using this platform,",
            "In the context of this demo,");
}
