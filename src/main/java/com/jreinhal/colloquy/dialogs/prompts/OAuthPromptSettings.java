package com.jreinhal.colloquy.dialogs.prompts;

/**
 * @param timeoutMs how long the prompt waits for a sign-in reply; null for {@link OAuthPrompt#DEFAULT_TIMEOUT_MS}
 * @param endOnInvalidMessage end with no result when a message carries no usable code
 * @param showSignInLink include the sign-in link on the card; Teams always gets it
 */
public record OAuthPromptSettings(
        String connectionName,
        String title,
        String text,
        Long timeoutMs,
        boolean endOnInvalidMessage,
        boolean showSignInLink
) {

    public OAuthPromptSettings(String connectionName, String title, String text) {
        this(connectionName, title, text, null, false, true);
    }

    public long effectiveTimeoutMs() {
        return this.timeoutMs == null ? OAuthPrompt.DEFAULT_TIMEOUT_MS : this.timeoutMs;
    }
}
