package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.dialogs.choices.KeywordBooleanRecognizer;
import com.jreinhal.colloquy.dialogs.choices.KeywordChoiceRecognizer;

/**
 * Factories for the built-in prompt variants.
 */
public final class Prompts {

    private Prompts() {
    }

    public static Prompt<String> text(String id) {
        return text(id, null);
    }

    public static Prompt<String> text(String id, PromptValidator<String> validator) {
        return new Prompt<>(id, new TextInputRenderer(), new TextInputRecognizer(), validator);
    }

    public static Prompt<Boolean> confirm(String id) {
        return confirm(id, null, new ConfirmPromptSettings());
    }

    public static Prompt<Boolean> confirm(String id, PromptValidator<Boolean> validator, String defaultLocale) {
        return confirm(id, validator, new ConfirmPromptSettings(defaultLocale, null));
    }

    public static Prompt<Boolean> confirm(String id, PromptValidator<Boolean> validator, ConfirmPromptSettings settings) {
        return new Prompt<>(id,
                new ConfirmChoiceRenderer(settings),
                new ConfirmChoiceRecognizer(settings, new KeywordBooleanRecognizer(), new KeywordChoiceRecognizer()),
                validator);
    }
}
