package com.jreinhal.colloquy.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.storage.Storage;
import com.jreinhal.colloquy.turn.TurnContext;

/**
 * State scoped to one conversation on one channel.
 */
public class ConversationState extends AgentState {

    public ConversationState(Storage storage, ObjectMapper objectMapper) {
        super(storage, objectMapper);
    }

    @Override
    public String getStorageKey(TurnContext context) {
        Activity activity = context.getActivity();
        String channelId = activity.getChannelId();
        String conversationId = activity.getConversation() == null ? null : activity.getConversation().id();
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalStateException("ConversationState: missing activity.channelId");
        }
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalStateException("ConversationState: missing activity.conversation.id");
        }
        return channelId + "/conversations/" + conversationId;
    }
}
