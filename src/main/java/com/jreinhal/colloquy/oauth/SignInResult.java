package com.jreinhal.colloquy.oauth;

/**
 * Outcome of one sign-in turn. {@code token} is null until the handler completes.
 */
public record SignInResult(String token, SignInHandlerState handler) {

    public boolean isSignedIn() {
        return this.token != null && !this.token.isBlank();
    }
}
