package com.jreinhal.colloquy.dialogs.choices;

import java.util.List;

/**
 * Finds yes/no answers in an utterance. Results are ordered by position in the utterance.
 */
public interface BooleanRecognizer {

    List<ModelResult<Boolean>> recognize(String utterance, String locale);
}
