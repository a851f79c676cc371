package com.jreinhal.colloquy.dialogs.memory;

import com.jreinhal.colloquy.dialogs.DialogContainer;
import com.jreinhal.colloquy.dialogs.DialogContext;
import com.jreinhal.colloquy.dialogs.DialogContextException;
import com.jreinhal.colloquy.dialogs.DialogContextSnapshot;
import com.jreinhal.colloquy.dialogs.DialogInstance;
import java.util.LinkedHashMap;

/**
 * State of the nearest container frame: the active frame when it is a container,
 * otherwise the parent's active frame when that one is.
 */
public class DialogMemoryScope extends MemoryScope {

    public DialogMemoryScope() {
        super(ScopePath.DIALOG, true);
    }

    @Override
    public Object getMemory(DialogContext dc) {
        DialogInstance active = bound(dc).getActiveDialog();
        return active == null ? new LinkedHashMap<String, Object>() : active.getState();
    }

    @Override
    public void setMemory(DialogContext dc, Object memory) {
        requireMemory(memory);
        DialogContext target = bound(dc);
        DialogInstance active = target.getActiveDialog();
        if (active == null) {
            throw new DialogContextException("DialogMemoryScope.setMemory(): no active dialog", DialogContextSnapshot.of(target));
        }
        active.setState(MemoryMaps.asRecord(memory));
    }

    private static DialogContext bound(DialogContext dc) {
        DialogContext parent = dc.getParent();
        if (!isContainer(dc) && parent != null && isContainer(parent)) {
            return parent;
        }
        return dc;
    }

    private static boolean isContainer(DialogContext dc) {
        DialogInstance active = dc.getActiveDialog();
        return active != null && dc.findDialog(active.getId()) instanceof DialogContainer;
    }
}
