package com.jreinhal.colloquy.dialogs.choices;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.jreinhal.colloquy.activity.CardAction;
import java.util.List;

/**
 * One option offered to the user. {@code synonyms} are recognized in addition to the value.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Choice(String value, CardAction action, List<String> synonyms) {

    public Choice {
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }

    public static Choice of(String value) {
        return new Choice(value, null, List.of());
    }

    public static List<Choice> of(List<String> values) {
        return values.stream().map(Choice::of).toList();
    }

    /**
     * What is shown for this choice: the action title when there is one, else the value.
     */
    public String title() {
        return this.action != null && this.action.title() != null ? this.action.title() : this.value;
    }
}
