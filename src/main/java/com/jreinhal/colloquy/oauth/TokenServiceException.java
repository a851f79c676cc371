package com.jreinhal.colloquy.oauth;

/**
 * The token service failed a call that has no "not yet" answer, such as sign-out.
 */
public class TokenServiceException extends RuntimeException {
    public TokenServiceException(String message) {
        super(message);
    }

    public TokenServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
