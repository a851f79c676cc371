package com.jreinhal.colloquy.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.storage.Storage;
import com.jreinhal.colloquy.turn.TurnContext;

/**
 * State scoped to one user on one channel, shared across that user's conversations.
 */
public class UserState extends AgentState {

    public UserState(Storage storage, ObjectMapper objectMapper) {
        super(storage, objectMapper);
    }

    @Override
    public String getStorageKey(TurnContext context) {
        Activity activity = context.getActivity();
        String channelId = activity.getChannelId();
        String userId = activity.getFrom() == null ? null : activity.getFrom().id();
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalStateException("UserState: missing activity.channelId");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalStateException("UserState: missing activity.from.id");
        }
        return channelId + "/users/" + userId;
    }
}
