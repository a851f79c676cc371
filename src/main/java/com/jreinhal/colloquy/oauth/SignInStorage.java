package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.storage.Storage;
import com.jreinhal.colloquy.turn.TurnContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Handler records keyed {@code auth/{channelId}/{userId}/{handlerId}}.
 */
public class SignInStorage {
    private final Storage storage;
    private final ObjectMapper objectMapper;
    private final List<String> handlerIds;

    public SignInStorage(Storage storage, ObjectMapper objectMapper, Collection<String> handlerIds) {
        if (storage == null) {
            throw new IllegalArgumentException("Storage is required");
        }
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.handlerIds = List.copyOf(handlerIds);
    }

    /**
     * First configured handler whose record is not {@code success}, or null.
     */
    public SignInHandlerState active(TurnContext context) {
        if (this.handlerIds.isEmpty()) {
            return null;
        }
        List<String> keys = new ArrayList<>();
        for (String id : this.handlerIds) {
            keys.add(key(context, id));
        }
        Map<String, Object> data = this.storage.read(keys);
        for (String key : keys) {
            Object stored = data.get(key);
            if (stored != null) {
                SignInHandlerState state = this.objectMapper.convertValue(stored, SignInHandlerState.class);
                if (state.getStatus() != SignInHandlerState.Status.SUCCESS) {
                    return state;
                }
            }
        }
        return null;
    }

    public SignInHandlerState get(TurnContext context, String id) {
        String key = key(context, id);
        Object stored = this.storage.read(List.of(key)).get(key);
        return stored == null ? null : this.objectMapper.convertValue(stored, SignInHandlerState.class);
    }

    public void set(TurnContext context, SignInHandlerState value) {
        this.storage.write(Map.of(key(context, value.getId()), value));
    }

    public void delete(TurnContext context, String id) {
        this.storage.delete(List.of(key(context, id)));
    }

    static String key(TurnContext context, String id) {
        Activity activity = context.getActivity();
        String channelId = activity.getChannelId();
        String userId = activity.getFrom() == null ? null : activity.getFrom().id();
        if (channelId == null || channelId.isBlank() || userId == null || userId.isBlank()) {
            throw new IllegalStateException("Activity 'channelId' and 'from.id' properties must be set.");
        }
        return "auth/" + channelId + "/" + userId + "/" + id;
    }
}
