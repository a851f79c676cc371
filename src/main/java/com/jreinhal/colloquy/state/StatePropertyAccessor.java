package com.jreinhal.colloquy.state;

import com.jreinhal.colloquy.turn.TurnContext;
import java.util.function.Supplier;

/**
 * Typed handle on one named property of an {@link AgentState} record.
 */
public class StatePropertyAccessor<T> {
    private final AgentState state;
    private final String name;
    private final Class<T> type;

    StatePropertyAccessor(AgentState state, String name, Class<T> type) {
        this.state = state;
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return this.name;
    }

    public T get(TurnContext context) {
        return this.state.getProperty(context, this.name, this.type);
    }

    /**
     * Returns the property, first storing the supplied default when it is absent.
     */
    public T get(TurnContext context, Supplier<T> defaultValue) {
        T value = get(context);
        if (value == null && defaultValue != null) {
            value = defaultValue.get();
            set(context, value);
        }
        return value;
    }

    public void set(TurnContext context, T value) {
        this.state.setProperty(context, this.name, value);
    }

    public void delete(TurnContext context) {
        this.state.deleteProperty(context, this.name);
    }
}
