package com.jreinhal.colloquy.dialogs;

/**
 * An event travelling from the active dialog up through its ancestors. Never persisted.
 */
public record DialogEvent(boolean bubble, String name, Object value) {

    public DialogEvents kind() {
        return DialogEvents.of(this.name);
    }
}
