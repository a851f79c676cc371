package com.jreinhal.colloquy.dialogs.choices;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordChoiceRecognizerTest {
    private final KeywordChoiceRecognizer recognizer = new KeywordChoiceRecognizer();
    private final List<Choice> colors = List.of(
            Choice.of("red"),
            new Choice("green", null, List.of("lime", "emerald")),
            Choice.of("blue"));

    @Test
    void matchesValuesAsWholeWords() {
        List<ModelResult<FoundChoice>> found = this.recognizer.recognize("I'd like Blue today", this.colors, "en-us");

        assertEquals(1, found.size());
        assertEquals("blue", found.get(0).resolution().value());
        assertEquals(2, found.get(0).resolution().index());
        assertEquals("Blue", found.get(0).text());
    }

    @Test
    void matchesSynonyms() {
        FoundChoice found = this.recognizer.recognize("emerald", this.colors, null).get(0).resolution();

        assertEquals("green", found.value());
        assertEquals("emerald", found.synonym());
    }

    @Test
    void doesNotMatchInsideWords() {
        assertThat(this.recognizer.recognize("bluebird", this.colors, null)).isEmpty();
    }

    @Test
    void ordersMatchesByPosition() {
        List<ModelResult<FoundChoice>> found = this.recognizer.recognize("blue then red", this.colors, null);

        assertEquals(List.of("blue", "red"), found.stream().map(result -> result.resolution().value()).toList());
    }

    @Test
    void selectsByNumberOrOrdinal() {
        assertEquals("green", this.recognizer.recognize("2", this.colors, null).get(0).resolution().value());
        assertEquals("red", this.recognizer.recognize("the first one", this.colors, null).get(0).resolution().value());
        assertEquals("blue", this.recognizer.recognize("last", this.colors, null).get(0).resolution().value());
    }

    @Test
    void ignoresOutOfRangeNumbersAndEmptyInput() {
        assertThat(this.recognizer.recognize("7", this.colors, null)).isEmpty();
        assertThat(this.recognizer.recognize(" ", this.colors, null)).isEmpty();
        assertThat(this.recognizer.recognize("red", List.of(), null)).isEmpty();
    }
}
