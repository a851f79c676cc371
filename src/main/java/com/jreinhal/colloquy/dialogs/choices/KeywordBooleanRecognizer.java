package com.jreinhal.colloquy.dialogs.choices;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Yes/no keyword lists per language. Unknown languages use the English list.
 */
public class KeywordBooleanRecognizer implements BooleanRecognizer {
    private static final Map<String, Keywords> KEYWORDS = Map.of(
            "en", new Keywords(
                    List.of("yes", "y", "yeah", "yep", "yup", "sure", "ok", "okay", "true", "correct", "affirmative", "of course"),
                    List.of("no", "n", "nope", "nah", "false", "negative", "not at all")),
            "nl", new Keywords(List.of("ja", "jazeker", "zeker", "oké"), List.of("nee", "neen", "niet")),
            "fr", new Keywords(List.of("oui", "ouais", "d'accord", "bien sûr"), List.of("non", "pas du tout")),
            "de", new Keywords(List.of("ja", "jawohl", "genau", "klar"), List.of("nein", "nee", "nö")),
            "it", new Keywords(List.of("si", "sì", "certo", "va bene"), List.of("no", "nessuno")),
            "pt", new Keywords(List.of("sim", "claro", "certo"), List.of("não", "nao")),
            "es", new Keywords(List.of("sí", "si", "claro", "vale"), List.of("no", "nunca")),
            "zh", new Keywords(List.of("是的", "是", "对", "好"), List.of("不是", "不", "否")),
            "ja", new Keywords(List.of("はい", "ええ", "うん"), List.of("いいえ", "いや", "ううん")));

    @Override
    public List<ModelResult<Boolean>> recognize(String utterance, String locale) {
        if (utterance == null || utterance.isBlank()) {
            return List.of();
        }
        Keywords keywords = KEYWORDS.getOrDefault(language(locale), KEYWORDS.get("en"));
        String lowered = utterance.toLowerCase(Locale.ROOT);
        boolean cjk = keywords == KEYWORDS.get("zh") || keywords == KEYWORDS.get("ja");
        List<ModelResult<Boolean>> results = new ArrayList<>();
        // "no" words first so that e.g. "不是" wins over its "是" suffix at the same position
        collect(results, lowered, utterance, keywords.no(), false, cjk);
        collect(results, lowered, utterance, keywords.yes(), true, cjk);
        results.sort(Comparator.comparingInt(ModelResult::start));
        return results;
    }

    private static void collect(List<ModelResult<Boolean>> results, String lowered, String utterance,
                                List<String> words, boolean value, boolean cjk) {
        for (String word : words) {
            Matcher matcher = pattern(word, cjk).matcher(lowered);
            if (matcher.find() && results.stream().noneMatch(r -> overlaps(r, matcher.start(), matcher.end() - 1))) {
                results.add(new ModelResult<>(utterance.substring(matcher.start(), matcher.end()),
                        matcher.start(), matcher.end() - 1, "boolean", value));
            }
        }
    }

    private static boolean overlaps(ModelResult<?> result, int start, int end) {
        return start <= result.end() && end >= result.start();
    }

    private static Pattern pattern(String word, boolean cjk) {
        String quoted = Pattern.quote(word);
        return cjk ? Pattern.compile(quoted) : Pattern.compile("(?<![\\p{L}\\d])" + quoted + "(?![\\p{L}\\d])");
    }

    private static String language(String locale) {
        if (locale == null || locale.isBlank()) {
            return "en";
        }
        return locale.toLowerCase(Locale.ROOT).split("-")[0].trim();
    }

    private record Keywords(List<String> yes, List<String> no) {}
}
