package com.jreinhal.colloquy.util;

import java.util.regex.Pattern;

/**
 * Helpers for putting user-supplied activity fields into log lines.
 */
public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_LOGGED_LENGTH = 256;

    private LogSanitizer() {
    }

    /**
     * Length and hash of a message text, so turns can be correlated without logging what the user typed.
     */
    public static String textSummary(String text) {
        if (text == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + text.length() + ",id=" + Integer.toHexString(text.hashCode()) + "]";
    }

    /**
     * Strips control characters so ids and names cannot forge log lines; long values are cut.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        return cleaned.length() > MAX_LOGGED_LENGTH ? cleaned.substring(0, MAX_LOGGED_LENGTH) + "..." : cleaned;
    }
}
