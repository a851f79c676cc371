package com.jreinhal.colloquy.dialogs;

/**
 * The engine was wired incorrectly. Never recovered from.
 */
public class DialogConfigurationException extends RuntimeException {
    public DialogConfigurationException(String message) {
        super(message);
    }
}
