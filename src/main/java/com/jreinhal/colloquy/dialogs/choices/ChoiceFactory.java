package com.jreinhal.colloquy.dialogs.choices;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.InputHints;
import java.util.List;

/**
 * Renders choices into the text of a prompt.
 */
public final class ChoiceFactory {
    public static final int MAX_INLINE_TITLE_LENGTH = 20;

    private ChoiceFactory() {
    }

    /**
     * Inline for up to three short choices, a numbered list otherwise.
     */
    public static Activity forChoices(List<Choice> choices, String text, ChoiceFactoryOptions options) {
        int longest = choices.stream().mapToInt(choice -> choice.title().length()).max().orElse(0);
        if (longest <= MAX_INLINE_TITLE_LENGTH && choices.size() <= 3) {
            return inline(choices, text, options);
        }
        return list(choices, text, options);
    }

    /**
     * {@code "Continue? (1) Yes or (2) No"}.
     */
    public static Activity inline(List<Choice> choices, String text, ChoiceFactoryOptions options) {
        ChoiceFactoryOptions opt = options == null ? ChoiceFactoryOptions.DEFAULT : options;
        StringBuilder txt = new StringBuilder(text == null ? "" : text).append(' ');
        String connector = "";
        for (int i = 0; i < choices.size(); i++) {
            txt.append(connector);
            if (opt.includeNumbers()) {
                txt.append('(').append(i + 1).append(") ");
            }
            txt.append(choices.get(i).title());
            if (i == choices.size() - 2) {
                connector = orEmpty(i == 0 ? opt.inlineOr() : opt.inlineOrMore());
            } else {
                connector = orEmpty(opt.inlineSeparator());
            }
        }
        return Activity.message(txt.toString(), InputHints.EXPECTING_INPUT);
    }

    public static Activity list(List<Choice> choices, String text, ChoiceFactoryOptions options) {
        boolean numbered = options == null || options.includeNumbers();
        StringBuilder txt = new StringBuilder(text == null ? "" : text).append("\n\n   ");
        String connector = "";
        for (int i = 0; i < choices.size(); i++) {
            txt.append(connector).append(numbered ? (i + 1) + ". " : "- ").append(choices.get(i).title());
            connector = "\n   ";
        }
        return Activity.message(txt.toString(), InputHints.EXPECTING_INPUT);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
