package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.turn.TurnContext;
import java.util.Map;

/**
 * Any non-empty message text.
 */
public class TextInputRecognizer implements PromptRecognizer<String> {

    @Override
    public PromptRecognizerResult<String> recognize(TurnContext context, Map<String, Object> state, PromptOptions options) {
        String text = context.getActivity().getText();
        return text == null || text.isEmpty() ? PromptRecognizerResult.failure() : PromptRecognizerResult.success(text);
    }
}
