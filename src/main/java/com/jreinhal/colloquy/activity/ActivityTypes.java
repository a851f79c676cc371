package com.jreinhal.colloquy.activity;

public final class ActivityTypes {
    public static final String MESSAGE = "message";
    public static final String EVENT = "event";
    public static final String INVOKE = "invoke";
    public static final String INVOKE_RESPONSE = "invokeResponse";
    public static final String TYPING = "typing";
    public static final String END_OF_CONVERSATION = "endOfConversation";
    public static final String CONVERSATION_UPDATE = "conversationUpdate";

    private ActivityTypes() {
    }
}
