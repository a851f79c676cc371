package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.InputHints;
import com.jreinhal.colloquy.turn.TurnContext;
import java.util.Map;

/**
 * Sends the prompt, or the retry prompt on a retry when one was given.
 */
public class TextInputRenderer implements PromptRenderer {

    @Override
    public void render(TurnContext context, Map<String, Object> state, PromptOptions options, boolean isRetry) {
        Activity stored = isRetry && options.getRetryPrompt() != null ? options.getRetryPrompt() : options.getPrompt();
        if (stored == null) {
            return;
        }
        Activity activity = stored.copy();
        if (activity.getInputHint() == null) {
            activity.setInputHint(InputHints.EXPECTING_INPUT);
        }
        context.sendActivity(activity);
    }
}
