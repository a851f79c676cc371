package com.jreinhal.colloquy.dialogs.prompts;

/**
 * Locale-specific words a confirm prompt renders.
 */
public record PromptCultureModel(
        String locale,
        String separator,
        String inlineOr,
        String inlineOrMore,
        String yesInLanguage,
        String noInLanguage
) {
}
