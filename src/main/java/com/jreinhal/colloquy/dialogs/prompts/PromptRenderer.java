package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.turn.TurnContext;
import java.util.Map;

/**
 * Sends the question of a prompt.
 */
@FunctionalInterface
public interface PromptRenderer {

    void render(TurnContext context, Map<String, Object> state, PromptOptions options, boolean isRetry);
}
