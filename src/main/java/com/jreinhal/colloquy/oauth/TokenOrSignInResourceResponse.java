package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Either a token the user already has, or what is needed to ask them to sign in.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenOrSignInResourceResponse(TokenResponse tokenResponse, SignInResource signInResource) {
}
