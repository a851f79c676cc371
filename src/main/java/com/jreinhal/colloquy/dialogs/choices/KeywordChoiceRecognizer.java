package com.jreinhal.colloquy.dialogs.choices;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches choice values and synonyms as whole words first. Failing that, a number
 * ({@code "2"}) or English ordinal ({@code "second"}, {@code "last"}) selects a choice by
 * position.
 */
public class KeywordChoiceRecognizer implements ChoiceRecognizer {
    private static final Pattern NUMBER = Pattern.compile("(?<![\\p{L}\\d])(\\d{1,3})(?![\\p{L}\\d])");
    private static final Map<String, Integer> ORDINALS = Map.ofEntries(
            Map.entry("first", 1), Map.entry("second", 2), Map.entry("third", 3), Map.entry("fourth", 4),
            Map.entry("fifth", 5), Map.entry("sixth", 6), Map.entry("seventh", 7), Map.entry("eighth", 8),
            Map.entry("ninth", 9), Map.entry("tenth", 10), Map.entry("1st", 1), Map.entry("2nd", 2),
            Map.entry("3rd", 3), Map.entry("4th", 4), Map.entry("5th", 5));

    @Override
    public List<ModelResult<FoundChoice>> recognize(String utterance, List<Choice> choices, String locale) {
        if (utterance == null || utterance.isBlank() || choices == null || choices.isEmpty()) {
            return List.of();
        }
        List<ModelResult<FoundChoice>> matches = findChoices(utterance, choices);
        if (!matches.isEmpty()) {
            return matches;
        }
        return findByPosition(utterance, choices);
    }

    private List<ModelResult<FoundChoice>> findChoices(String utterance, List<Choice> choices) {
        String lowered = utterance.toLowerCase(Locale.ROOT);
        List<ModelResult<FoundChoice>> matches = new ArrayList<>();
        for (int index = 0; index < choices.size(); index++) {
            Choice choice = choices.get(index);
            List<String> candidates = new ArrayList<>();
            candidates.add(choice.value());
            if (choice.action() != null && choice.action().title() != null) {
                candidates.add(choice.action().title());
            }
            candidates.addAll(choice.synonyms());
            for (String candidate : candidates) {
                if (candidate == null || candidate.isBlank()) {
                    continue;
                }
                Matcher matcher = wholeWord(candidate).matcher(lowered);
                if (matcher.find()) {
                    double score = (double) candidate.length() / utterance.trim().length();
                    matches.add(new ModelResult<>(utterance.substring(matcher.start(), matcher.end()),
                            matcher.start(), matcher.end() - 1, "choice",
                            new FoundChoice(choice.value(), index, Math.min(1.0, score), candidate)));
                    break;
                }
            }
        }
        matches.sort(Comparator.comparingInt(ModelResult::start));
        return matches;
    }

    private List<ModelResult<FoundChoice>> findByPosition(String utterance, List<Choice> choices) {
        List<ModelResult<FoundChoice>> matches = new ArrayList<>();
        Matcher number = NUMBER.matcher(utterance);
        while (number.find()) {
            addPosition(matches, choices, Integer.parseInt(number.group(1)), number.start(), number.end(), utterance);
        }
        String lowered = utterance.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Integer> ordinal : ORDINALS.entrySet()) {
            Matcher matcher = wholeWord(ordinal.getKey()).matcher(lowered);
            if (matcher.find()) {
                addPosition(matches, choices, ordinal.getValue(), matcher.start(), matcher.end(), utterance);
            }
        }
        Matcher last = wholeWord("last").matcher(lowered);
        if (last.find()) {
            addPosition(matches, choices, choices.size(), last.start(), last.end(), utterance);
        }
        matches.sort(Comparator.comparingInt(ModelResult::start));
        return matches;
    }

    private static void addPosition(List<ModelResult<FoundChoice>> matches, List<Choice> choices, int position,
                                    int start, int end, String utterance) {
        if (position < 1 || position > choices.size()) {
            return;
        }
        Choice choice = choices.get(position - 1);
        matches.add(new ModelResult<>(utterance.substring(start, end), start, end - 1, "choice",
                new FoundChoice(choice.value(), position - 1, 1.0, null)));
    }

    private static Pattern wholeWord(String candidate) {
        return Pattern.compile("(?<![\\p{L}\\d])" + Pattern.quote(candidate.toLowerCase(Locale.ROOT)) + "(?![\\p{L}\\d])");
    }
}
