package com.jreinhal.colloquy.dialogs.prompts;

/**
 * How a prompt presents its choices.
 */
public enum ListStyle {
    NONE,
    AUTO,
    INLINE,
    LIST
}
