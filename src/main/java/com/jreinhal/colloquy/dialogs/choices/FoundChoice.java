package com.jreinhal.colloquy.dialogs.choices;

/**
 * @param index position of the matched choice in the offered list
 * @param synonym the value or synonym that matched, if the match was textual
 */
public record FoundChoice(String value, int index, double score, String synonym) {
}
