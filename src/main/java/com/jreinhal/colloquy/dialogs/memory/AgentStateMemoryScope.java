package com.jreinhal.colloquy.dialogs.memory;

import com.jreinhal.colloquy.dialogs.DialogContext;
import com.jreinhal.colloquy.state.AgentState;

/**
 * The loaded record of an {@link AgentState}. Paths inside it are writable; the record
 * itself cannot be replaced.
 */
public class AgentStateMemoryScope extends MemoryScope {
    private final AgentState state;

    public AgentStateMemoryScope(String name, AgentState state) {
        super(name, true);
        this.state = state;
    }

    @Override
    public Object getMemory(DialogContext dc) {
        return this.state.get(dc.getContext());
    }

    @Override
    public void setMemory(DialogContext dc, Object memory) {
        throw new IllegalStateException("You cannot replace the root " + getName() + " state object");
    }
}
