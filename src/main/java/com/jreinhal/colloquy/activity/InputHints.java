package com.jreinhal.colloquy.activity;

public final class InputHints {
    public static final String ACCEPTING_INPUT = "acceptingInput";
    public static final String EXPECTING_INPUT = "expectingInput";
    public static final String IGNORING_INPUT = "ignoringInput";

    private InputHints() {
    }
}
