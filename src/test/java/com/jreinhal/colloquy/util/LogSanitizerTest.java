package com.jreinhal.colloquy.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    @DisplayName("text summary never contains the text")
    void summaryHidesText() {
        assertThat(LogSanitizer.textSummary(null)).isEqualTo("[len=0,id=none]");
        assertThat(LogSanitizer.textSummary("my code is 123456"))
                .startsWith("[len=17,id=")
                .doesNotContain("123456");
    }

    @Test
    @DisplayName("forged log lines are flattened")
    void stripsLineBreaks() {
        assertThat(LogSanitizer.sanitize("conv-1\r\nINFO fake entry")).isEqualTo("conv-1 INFO fake entry");
        assertThat(LogSanitizer.sanitize("a\u0000b\u001bc")).isEqualTo("abc");
        assertThat(LogSanitizer.sanitize(null)).isEmpty();
    }

    @Test
    @DisplayName("long values are truncated")
    void truncatesLongValues() {
        assertThat(LogSanitizer.sanitize("x".repeat(300))).hasSize(259).endsWith("...");
    }
}
