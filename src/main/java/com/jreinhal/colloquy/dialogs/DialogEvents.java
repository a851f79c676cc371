package com.jreinhal.colloquy.dialogs;

import java.util.Arrays;

/**
 * Well-known dialog event names. Anything else classifies as {@link #CUSTOM}.
 */
public enum DialogEvents {
    BEGIN_DIALOG("beginDialog"),
    REPROMPT_DIALOG("repromptDialog"),
    CANCEL_DIALOG("cancelDialog"),
    ACTIVITY_RECEIVED("activityReceived"),
    VERSION_CHANGED("versionChanged"),
    ERROR("error"),
    CUSTOM(null);

    private final String eventName;

    DialogEvents(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return this.eventName;
    }

    public static DialogEvents of(String name) {
        return Arrays.stream(values())
                .filter(kind -> kind.eventName != null && kind.eventName.equals(name))
                .findFirst()
                .orElse(CUSTOM);
    }
}
