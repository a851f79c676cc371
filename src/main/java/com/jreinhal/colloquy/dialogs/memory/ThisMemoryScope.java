package com.jreinhal.colloquy.dialogs.memory;

import com.jreinhal.colloquy.dialogs.DialogContext;
import com.jreinhal.colloquy.dialogs.DialogContextException;
import com.jreinhal.colloquy.dialogs.DialogContextSnapshot;
import com.jreinhal.colloquy.dialogs.DialogInstance;
import java.util.LinkedHashMap;

/**
 * State of the active frame. Empty when no dialog is active.
 */
public class ThisMemoryScope extends MemoryScope {

    public ThisMemoryScope() {
        super(ScopePath.THIS, true);
    }

    @Override
    public Object getMemory(DialogContext dc) {
        DialogInstance active = dc.getActiveDialog();
        return active == null ? new LinkedHashMap<String, Object>() : active.getState();
    }

    @Override
    public void setMemory(DialogContext dc, Object memory) {
        requireMemory(memory);
        DialogInstance active = dc.getActiveDialog();
        if (active == null) {
            throw new DialogContextException("ThisMemoryScope.setMemory(): no active dialog", DialogContextSnapshot.of(dc));
        }
        active.setState(MemoryMaps.asRecord(memory));
    }
}
