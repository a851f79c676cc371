package com.jreinhal.colloquy.dialogs.prompts;

public record PromptRecognizerResult<T>(boolean succeeded, T value) {

    public static <T> PromptRecognizerResult<T> success(T value) {
        return new PromptRecognizerResult<>(true, value);
    }

    public static <T> PromptRecognizerResult<T> failure() {
        return new PromptRecognizerResult<>(false, null);
    }
}
