package com.jreinhal.colloquy.dialogs.choices;

import java.util.List;

/**
 * Matches an utterance against offered choices. Results are ordered by position in the
 * utterance; an empty list means nothing matched.
 */
public interface ChoiceRecognizer {

    List<ModelResult<FoundChoice>> recognize(String utterance, List<Choice> choices, String locale);
}
