package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.turn.TurnContext;
import java.util.Map;

/**
 * Extracts the answer of a prompt from the inbound activity.
 */
@FunctionalInterface
public interface PromptRecognizer<T> {

    PromptRecognizerResult<T> recognize(TurnContext context, Map<String, Object> state, PromptOptions options);
}
