package com.jreinhal.colloquy.dialogs.prompts;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.InputHints;
import com.jreinhal.colloquy.dialogs.choices.Choice;
import java.util.List;

/**
 * What a prompt asks, what it asks again after a failed attempt, and the choices it offers.
 * Persisted in the prompt's frame.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptOptions {
    private Activity prompt;
    private Activity retryPrompt;
    private List<Choice> choices;
    private ListStyle style;
    private Object validations;
    private String recognizeLanguage;

    public PromptOptions() {}

    public PromptOptions(Activity prompt) {
        this.prompt = prompt;
    }

    public static PromptOptions text(String prompt) {
        return new PromptOptions(Activity.message(prompt, InputHints.EXPECTING_INPUT));
    }

    public static PromptOptions text(String prompt, String retryPrompt) {
        PromptOptions options = text(prompt);
        options.setRetryPrompt(Activity.message(retryPrompt, InputHints.EXPECTING_INPUT));
        return options;
    }

    public Activity getPrompt() { return prompt; }
    public void setPrompt(Activity prompt) { this.prompt = prompt; }
    public Activity getRetryPrompt() { return retryPrompt; }
    public void setRetryPrompt(Activity retryPrompt) { this.retryPrompt = retryPrompt; }
    public List<Choice> getChoices() { return choices; }
    public void setChoices(List<Choice> choices) { this.choices = choices; }
    public ListStyle getStyle() { return style; }
    public void setStyle(ListStyle style) { this.style = style; }
    public Object getValidations() { return validations; }
    public void setValidations(Object validations) { this.validations = validations; }
    public String getRecognizeLanguage() { return recognizeLanguage; }
    public void setRecognizeLanguage(String recognizeLanguage) { this.recognizeLanguage = recognizeLanguage; }
}
