package com.jreinhal.colloquy.dialogs.prompts;

/**
 * Decides whether a recognized value is acceptable. Overrides the recognizer's verdict.
 */
@FunctionalInterface
public interface PromptValidator<T> {

    boolean validate(PromptValidatorContext<T> prompt);
}
