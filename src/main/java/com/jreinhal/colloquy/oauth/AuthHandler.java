package com.jreinhal.colloquy.oauth;

/**
 * A named sign-in connection and the flow that drives it.
 */
public record AuthHandler(String id, String connectionName, String title, String text, OAuthFlow flow) {
}
