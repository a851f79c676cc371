package com.jreinhal.colloquy.dialogs.memory;

import com.jreinhal.colloquy.state.ConversationState;
import com.jreinhal.colloquy.state.UserState;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable set of memory scopes, looked up by case-insensitive name.
 */
public final class MemoryScopes {
    private final Map<String, MemoryScope> scopes;

    private MemoryScopes(Map<String, MemoryScope> scopes) {
        this.scopes = Collections.unmodifiableMap(scopes);
    }

    public static MemoryScopes of(MemoryScope... scopes) {
        Map<String, MemoryScope> byName = new LinkedHashMap<>();
        for (MemoryScope scope : scopes) {
            byName.put(key(scope.getName()), scope);
        }
        return new MemoryScopes(byName);
    }

    /**
     * this, turn, dialog, class, dialogClass and dialogContext.
     */
    public static MemoryScopes defaults() {
        return of(new TurnMemoryScope(), new ThisMemoryScope(), new DialogMemoryScope(),
                new ClassMemoryScope(), new DialogClassMemoryScope(), new DialogContextMemoryScope());
    }

    public MemoryScopes with(MemoryScope scope) {
        Map<String, MemoryScope> byName = new LinkedHashMap<>(this.scopes);
        byName.put(key(scope.getName()), scope);
        return new MemoryScopes(byName);
    }

    public MemoryScopes withAgentState(ConversationState conversationState, UserState userState) {
        return with(new AgentStateMemoryScope(ScopePath.CONVERSATION, conversationState))
                .with(new AgentStateMemoryScope(ScopePath.USER, userState));
    }

    public MemoryScope get(String name) {
        return name == null ? null : this.scopes.get(key(name));
    }

    public Collection<MemoryScope> all() {
        return this.scopes.values();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
