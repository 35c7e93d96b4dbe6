package com.example.agentdemo.Variant;

import com.example.agentdemo.Enum.VariantKind;
import com.example.agentdemo.Util.TextNormalizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 바꿔 말하기 규칙 목록 (선언 순서 = 적용 순서)
 * 각 규칙은 (text, kind, random) 만 보고 결과를 내는 순수 함수.
 * 결과가 입력과 같으면 변형 없음으로 취급한다.
 */
public enum ParaphraseTechnique {

    SYNONYM_REPLACEMENT("synonymReplacement", 0.9) {
        @Override
        String rewrite(String text, VariantKind kind, Random random) {
            // 단어마다 30% 확률로 치환
            return Lexicon.SYNONYMS.apply(text, Lexicon.SYNONYMS.pick(random, 0.7));
        }
    },

    SENTENCE_RESTRUCTURING("sentenceRestructuring", 0.8) {
        @Override
        String rewrite(String text, VariantKind kind, Random random) {
            if (kind == VariantKind.QUESTION) {
                for (Rewrite opener : QUESTION_OPENERS) {
                    Matcher m = opener.pattern().matcher(text);
                    if (m.lookingAt()) {
                        return opener.replacement() + text.substring(m.end());
                    }
                }
                return text;
            }
            // 답변: 앞의 두 문장 순서 교체
            String[] sentences = text.split("\\. ", -1);
            if (sentences.length < 2) {
                return text;
            }
            String first = sentences[0];
            String second = sentences[1];
            // 두 문장뿐이면 마침표가 뒤로 가도록 맞춤
            if (sentences.length == 2 && second.endsWith(".")) {
                second = second.substring(0, second.length() - 1);
                first = first + ".";
            }
            sentences[0] = second;
            sentences[1] = first;
            return String.join(". ", sentences);
        }
    },

    FORMAL_INFORMAL("formalInformal", 0.85) {
        @Override
        String rewrite(String text, VariantKind kind, Random random) {
            WordSwap table = random.nextDouble() > 0.5 ? Lexicon.FORMAL_TO_INFORMAL : Lexicon.INFORMAL_TO_FORMAL;
            return table.apply(text);
        }
    },

    ACTIVE_PASSIVE("activePassive", 0.7) {
        @Override
        String rewrite(String text, VariantKind kind, Random random) {
            String result = text;
            for (Rewrite rule : PASSIVE_RULES) {
                if (random.nextDouble() > 0.6) {
                    result = rule.pattern().matcher(result).replaceAll(rule.replacement());
                }
            }
            return result;
        }
    },

    QUESTION_STYLE("questionStyle", 0.8) {
        @Override
        String rewrite(String text, VariantKind kind, Random random) {
            if (kind != VariantKind.QUESTION || INTERROGATIVE_START.matcher(text).lookingAt()) {
                return text;
            }
            String starter = pickOne(Lexicon.QUESTION_STARTERS, random);
            return starter + " " + text.toLowerCase(Locale.ROOT);
        }
    },

    EXPAND_CONTRACT("expandContract", 0.9) {
        @Override
        String rewrite(String text, VariantKind kind, Random random) {
            WordSwap table = random.nextDouble() > 0.5 ? Lexicon.EXPAND_CONTRACTIONS : Lexicon.CONTRACT_PHRASES;
            return table.apply(text);
        }
    },

    ORDER_CHANGE("orderChange", 0.6) {
        @Override
        String rewrite(String text, VariantKind kind, Random random) {
            if (kind != VariantKind.QUESTION) {
                return text;
            }
            List<String> words = new ArrayList<>(Arrays.asList(text.split(" ")));
            if (words.size() <= 3 || !WH_WORD.matcher(words.get(0)).matches()) {
                return text;
            }
            // 의문사를 세 번째 자리로 이동
            String questionWord = words.remove(0).toLowerCase(Locale.ROOT);
            words.add(2, questionWord);
            return WordSwap.capitalize(String.join(" ", words));
        }
    },

    EMPHASIS_SHIFT("emphasisShift", 0.7) {
        @Override
        String rewrite(String text, VariantKind kind, Random random) {
            String emphasis = pickOne(Lexicon.EMPHASIS_WORDS, random);
            if (kind != VariantKind.QUESTION) {
                return text;
            }
            return HOW_WHAT.matcher(text).replaceAll("$1 " + emphasis);
        }
    },

    PERSPECTIVE_CHANGE("perspectiveChange", 0.6) {
        @Override
        String rewrite(String text, VariantKind kind, Random random) {
            return Lexicon.PERSPECTIVE.apply(text, Lexicon.PERSPECTIVE.pick(random, 0.7));
        }
    },

    CONTEXTUAL_VARIATION("contextualVariation", 0.8) {
        @Override
        String rewrite(String text, VariantKind kind, Random random) {
            if (kind != VariantKind.QUESTION || random.nextDouble() <= 0.5) {
                return text;
            }
            String context = pickOne(Lexicon.CONTEXTS, random);
            return context + " " + text.toLowerCase(Locale.ROOT);
        }
    };

    private static final List<Rewrite> QUESTION_OPENERS = List.of(
            Rewrite.of("how do i\\b", "What is the process to"),
            Rewrite.of("what is\\b", "Could you explain what"),
            Rewrite.of("can i\\b", "Is it possible for me to"),
            Rewrite.of("where\\b", "In what location"));

    private static final List<Rewrite> PASSIVE_RULES = List.of(
            Rewrite.of("\\bI (can|will|should) (\\w+)", "The $2 process can be"),
            Rewrite.of("\\bYou (can|will|should) (\\w+)", "The $2 action can be performed"),
            Rewrite.of("\\bThe system (\\w+s)\\b", "It is $1 by the system"));

    private static final Pattern INTERROGATIVE_START =
            Pattern.compile("(how|what|when|where|why|can|could|would|should)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WH_WORD = Pattern.compile("how|what|when|where|why", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOW_WHAT = Pattern.compile("\\b(how|what)\\b", Pattern.CASE_INSENSITIVE);

    private final String label;
    private final double confidence;

    ParaphraseTechnique(String label, double confidence) {
        this.label = label;
        this.confidence = confidence;
    }

    public String label() {
        return label;
    }

    public double confidence() {
        return confidence;
    }

    abstract String rewrite(String text, VariantKind kind, Random random);

    /**
     * 규칙 적용
     * @param text 원문 (태그가 있으면 제거 후 적용)
     * @param kind 질문/답변
     * @param html 답변 HTML (없으면 null)
     * @return 입력과 달라진 경우에만 결과, 그대로면 empty
     */
    public Optional<ParaphraseResult> apply(String text, VariantKind kind, String html, Random random) {
        String source = TextNormalizer.stripHtml(text);
        String rewritten = rewrite(source, kind, random);
        if (rewritten.equals(source)) {
            return Optional.empty();
        }
        return Optional.of(ParaphraseResult.of(source, rewritten, html, confidence));
    }

    private record Rewrite(Pattern pattern, String replacement) {
        static Rewrite of(String regex, String replacement) {
            return new Rewrite(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
        }
    }

    private static String pickOne(List<String> options, Random random) {
        return options.get(random.nextInt(options.size()));
    }
}
