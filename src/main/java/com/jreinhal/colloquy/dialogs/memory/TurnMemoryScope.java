package com.jreinhal.colloquy.dialogs.memory;

import com.jreinhal.colloquy.dialogs.DialogContext;

public class TurnMemoryScope extends MemoryScope {

    public TurnMemoryScope() {
        super(ScopePath.TURN, true);
    }

    @Override
    public Object getMemory(DialogContext dc) {
        return dc.getContext().getTurnMemory();
    }

    @Override
    public void setMemory(DialogContext dc, Object memory) {
        requireMemory(memory);
        dc.getContext().setTurnMemory(MemoryMaps.asRecord(memory));
    }
}
