package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.turn.TurnContext;
import java.util.Map;

/**
 * @param state the prompt's own scratch record, persisted between attempts
 * @param attemptCount number of validations for this prompt so far, including this one
 */
public record PromptValidatorContext<T>(
        TurnContext context,
        PromptRecognizerResult<T> recognized,
        Map<String, Object> state,
        PromptOptions options,
        int attemptCount
) {
}
