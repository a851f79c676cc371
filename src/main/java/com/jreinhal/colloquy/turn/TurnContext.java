package com.jreinhal.colloquy.turn;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.ChannelAccount;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything that belongs to the processing of exactly one inbound activity.
 *
 * <p>Per-turn data lives in explicit fields rather than a keyed bag: the turn memory
 * record backing the {@code turn} scope, the agent-state records loaded during the
 * turn, and the login timeout an OAuth card advertised.</p>
 */
public class TurnContext {

    private final Activity activity;
    private final ActivitySender sender;
    private final List<Activity> sentActivities = new ArrayList<>();
    private final Map<Object, Object> loadedState = new IdentityHashMap<>();
    private Map<String, Object> turnMemory;
    private boolean responded;
    private Long loginTimeoutMs;

    public TurnContext(Activity activity, ActivitySender sender) {
        this.activity = Objects.requireNonNull(activity, "activity");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    public Activity getActivity() {
        return this.activity;
    }

    public void sendActivity(Activity outbound) {
        sendActivities(List.of(outbound));
    }

    public void sendActivity(String text, String inputHint) {
        sendActivity(Activity.message(text, inputHint));
    }

    public void sendActivities(List<Activity> outbound) {
        if (outbound.isEmpty()) {
            return;
        }
        for (Activity reply : outbound) {
            applyConversationReference(reply);
        }
        this.sender.send(outbound);
        this.sentActivities.addAll(outbound);
        this.responded = true;
    }

    public boolean isResponded() {
        return this.responded;
    }

    public List<Activity> getSentActivities() {
        return List.copyOf(this.sentActivities);
    }

    /**
     * Ephemeral record behind the {@code turn} memory scope, created on first access.
     */
    public Map<String, Object> getTurnMemory() {
        if (this.turnMemory == null) {
            this.turnMemory = new LinkedHashMap<>();
        }
        return this.turnMemory;
    }

    public void setTurnMemory(Map<String, Object> turnMemory) {
        this.turnMemory = Objects.requireNonNull(turnMemory, "turnMemory");
    }

    public Long getLoginTimeoutMs() {
        return this.loginTimeoutMs;
    }

    public void setLoginTimeoutMs(Long loginTimeoutMs) {
        this.loginTimeoutMs = loginTimeoutMs;
    }

    /**
     * Records cached for this turn by their owner (an agent-state instance). Identity keyed.
     */
    @SuppressWarnings("unchecked")
    public <T> T getLoadedState(Object owner) {
        return (T) this.loadedState.get(owner);
    }

    public void putLoadedState(Object owner, Object record) {
        this.loadedState.put(owner, record);
    }

    public void clearLoadedState(Object owner) {
        this.loadedState.remove(owner);
    }

    private void applyConversationReference(Activity reply) {
        if (reply.getChannelId() == null) {
            reply.setChannelId(this.activity.getChannelId());
        }
        if (reply.getConversation() == null) {
            reply.setConversation(this.activity.getConversation());
        }
        if (reply.getFrom() == null) {
            reply.setFrom(this.activity.getRecipient());
        }
        if (reply.getRecipient() == null) {
            ChannelAccount user = this.activity.getFrom();
            reply.setRecipient(user);
        }
        if (reply.getReplyToId() == null) {
            reply.setReplyToId(this.activity.getId());
        }
        if (reply.getServiceUrl() == null) {
            reply.setServiceUrl(this.activity.getServiceUrl());
        }
    }
}
