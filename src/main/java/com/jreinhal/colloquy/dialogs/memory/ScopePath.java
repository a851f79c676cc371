package com.jreinhal.colloquy.dialogs.memory;

/**
 * Names of the built-in memory scopes, and well-known paths within them.
 */
public final class ScopePath {
    public static final String USER = "user";
    public static final String CONVERSATION = "conversation";
    public static final String DIALOG = "dialog";
    public static final String DIALOG_CLASS = "dialogClass";
    public static final String DIALOG_CONTEXT = "dialogContext";
    public static final String THIS = "this";
    public static final String CLASS = "class";
    public static final String TURN = "turn";

    /** Key in turn memory holding the result of the dialog that ended last. */
    public static final String LAST_RESULT = "lastresult";
    public static final String TURN_LAST_RESULT = TURN + "." + LAST_RESULT;

    private ScopePath() {
    }
}
