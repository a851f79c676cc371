package com.jreinhal.colloquy.dialogs.memory;

import com.jreinhal.colloquy.dialogs.DialogContext;

/**
 * A named view of conversational state, resolved against a dialog context.
 */
public abstract class MemoryScope {
    private final String name;
    private final boolean settable;

    protected MemoryScope(String name, boolean settable) {
        this.name = name;
        this.settable = settable;
    }

    public String getName() {
        return this.name;
    }

    public boolean isSettable() {
        return this.settable;
    }

    public abstract Object getMemory(DialogContext dc);

    public void setMemory(DialogContext dc, Object memory) {
        throw new IllegalStateException("The '" + this.name + "' memory scope is read only");
    }

    protected void requireMemory(Object memory) {
        if (memory == null) {
            throw new IllegalArgumentException(getClass().getSimpleName() + ".setMemory(): undefined memory object");
        }
    }
}
