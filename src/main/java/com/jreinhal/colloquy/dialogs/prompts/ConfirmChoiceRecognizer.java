package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.dialogs.choices.BooleanRecognizer;
import com.jreinhal.colloquy.dialogs.choices.Choice;
import com.jreinhal.colloquy.dialogs.choices.ChoiceFactoryOptions;
import com.jreinhal.colloquy.dialogs.choices.ChoiceRecognizer;
import com.jreinhal.colloquy.dialogs.choices.FoundChoice;
import com.jreinhal.colloquy.dialogs.choices.ModelResult;
import com.jreinhal.colloquy.turn.TurnContext;
import java.util.List;
import java.util.Map;

/**
 * Yes/no from the boolean recognizer; failing that, and when numbers are shown, a match
 * against the two confirm choices where the first means true.
 */
public class ConfirmChoiceRecognizer implements PromptRecognizer<Boolean> {
    private final ConfirmPromptSettings settings;
    private final BooleanRecognizer booleanRecognizer;
    private final ChoiceRecognizer choiceRecognizer;

    public ConfirmChoiceRecognizer(ConfirmPromptSettings settings, BooleanRecognizer booleanRecognizer,
                                   ChoiceRecognizer choiceRecognizer) {
        this.settings = settings;
        this.booleanRecognizer = booleanRecognizer;
        this.choiceRecognizer = choiceRecognizer;
    }

    @Override
    public PromptRecognizerResult<Boolean> recognize(TurnContext context, Map<String, Object> state, PromptOptions options) {
        String utterance = context.getActivity().getText();
        if (utterance == null || utterance.isEmpty()) {
            return PromptRecognizerResult.failure();
        }
        String culture = this.settings.determineCulture(context.getActivity());
        String language = options.getRecognizeLanguage() != null ? options.getRecognizeLanguage() : culture;
        List<ModelResult<Boolean>> results = this.booleanRecognizer.recognize(utterance, language);
        if (!results.isEmpty() && results.get(0).resolution() != null) {
            return PromptRecognizerResult.success(results.get(0).resolution());
        }
        ChoiceFactoryOptions choiceOptions = this.settings.optionsFor(culture);
        if (choiceOptions.includeNumbers()) {
            List<Choice> confirmChoices = this.settings.choicesFor(culture);
            List<ModelResult<FoundChoice>> found = this.choiceRecognizer.recognize(
                    utterance, List.of(confirmChoices.get(0), confirmChoices.get(1)), language);
            if (!found.isEmpty()) {
                return PromptRecognizerResult.success(found.get(0).resolution().index() == 0);
            }
        }
        return PromptRecognizerResult.failure();
    }
}
