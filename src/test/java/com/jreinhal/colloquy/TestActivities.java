package com.jreinhal.colloquy;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.ActivityTypes;
import com.jreinhal.colloquy.activity.ChannelAccount;
import com.jreinhal.colloquy.activity.ConversationAccount;
import com.jreinhal.colloquy.turn.TurnContext;

/**
 * Inbound activities from user {@code user-1} in conversation {@code conv-1} on the test channel.
 */
public final class TestActivities {
    public static final String CHANNEL = "test";
    public static final String CONVERSATION = "conv-1";
    public static final String USER = "user-1";

    private TestActivities() {
    }

    public static Activity message(String text) {
        return address(Activity.message(text));
    }

    public static Activity event(String name, Object value) {
        Activity activity = new Activity(ActivityTypes.EVENT);
        activity.setName(name);
        activity.setValue(value);
        return address(activity);
    }

    public static Activity invoke(String name, Object value) {
        Activity activity = new Activity(ActivityTypes.INVOKE);
        activity.setName(name);
        activity.setValue(value);
        return address(activity);
    }

    public static Activity inConversation(Activity activity, String conversationId) {
        activity.setConversation(new ConversationAccount(conversationId));
        return activity;
    }

    public static TurnContext turn(Activity activity) {
        return new TurnContext(activity, sent -> {});
    }


    private static Activity address(Activity activity) {
        activity.setId("act-" + System.nanoTime());
        activity.setChannelId(CHANNEL);
        activity.setConversation(new ConversationAccount(CONVERSATION));
        activity.setFrom(new ChannelAccount(USER, "User"));
        activity.setRecipient(new ChannelAccount("agent", "Agent"));
        return activity;
    }
}
