package com.jreinhal.colloquy.dialogs.choices;

/**
 * Connectors used when choices are rendered inline, and whether they are numbered.
 */
public record ChoiceFactoryOptions(String inlineSeparator, String inlineOr, String inlineOrMore, boolean includeNumbers) {

    public static final ChoiceFactoryOptions DEFAULT = new ChoiceFactoryOptions(", ", " or ", ", or ", true);
}
