package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.InputHints;
import com.jreinhal.colloquy.dialogs.choices.Choice;
import com.jreinhal.colloquy.dialogs.choices.ChoiceFactory;
import com.jreinhal.colloquy.dialogs.choices.ChoiceFactoryOptions;
import com.jreinhal.colloquy.turn.TurnContext;
import java.util.List;
import java.util.Map;

/**
 * Sends the prompt with the yes/no choices of the resolved culture appended.
 */
public class ConfirmChoiceRenderer implements PromptRenderer {
    private final ConfirmPromptSettings settings;

    public ConfirmChoiceRenderer(ConfirmPromptSettings settings) {
        this.settings = settings;
    }

    @Override
    public void render(TurnContext context, Map<String, Object> state, PromptOptions options, boolean isRetry) {
        String culture = this.settings.determineCulture(context.getActivity());
        Activity prompt = isRetry && options.getRetryPrompt() != null ? options.getRetryPrompt() : options.getPrompt();
        ListStyle style = options.getStyle() != null ? options.getStyle() : this.settings.getStyle();
        context.sendActivity(appendChoices(prompt, this.settings.choicesFor(culture), style, this.settings.optionsFor(culture)));
    }

    static Activity appendChoices(Activity prompt, List<Choice> choices, ListStyle style, ChoiceFactoryOptions options) {
        String text = prompt == null ? "" : prompt.getText();
        Activity rendered = switch (style) {
            case NONE -> Activity.message(text, InputHints.EXPECTING_INPUT);
            case INLINE -> ChoiceFactory.inline(choices, text, options);
            case LIST -> ChoiceFactory.list(choices, text, options);
            case AUTO -> ChoiceFactory.forChoices(choices, text, options);
        };
        if (prompt != null) {
            rendered.getAttachments().addAll(prompt.getAttachments());
            if (prompt.getInputHint() != null) {
                rendered.setInputHint(prompt.getInputHint());
            }
            rendered.setLocale(prompt.getLocale());
        }
        return rendered;
    }
}
