package com.jreinhal.colloquy.dialogs.choices;

/**
 * A span of the utterance a recognizer matched, with what it resolved to.
 */
public record ModelResult<T>(String text, int start, int end, String typeName, T resolution) {
}
