package com.jreinhal.colloquy.dialogs.memory;

import com.jreinhal.colloquy.dialogs.DialogContext;
import com.jreinhal.colloquy.dialogs.DialogInstance;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only introspection: {@code stack} lists every frame id from the deepest child
 * context up to the root, each level top frame first; {@code activeDialog} and
 * {@code parent} name the active dialogs of this context and its parent.
 */
public class DialogContextMemoryScope extends MemoryScope {
    static final String INTERNAL_PREFIX = "ActionScope[";

    public DialogContextMemoryScope() {
        super(ScopePath.DIALOG_CONTEXT, false);
    }

    @Override
    public Object getMemory(DialogContext dc) {
        DialogContext current = dc;
        DialogContext child = current.getChild();
        while (child != null) {
            current = child;
            child = current.getChild();
        }
        List<String> stack = new ArrayList<>();
        while (current != null) {
            for (DialogInstance frame : current.getStack()) {
                if (!frame.getId().startsWith(INTERNAL_PREFIX)) {
                    stack.add(frame.getId());
                }
            }
            current = current.getParent();
        }
        Map<String, Object> memory = new LinkedHashMap<>();
        memory.put("stack", stack);
        memory.put("activeDialog", dc.getActiveDialog() == null ? null : dc.getActiveDialog().getId());
        DialogContext parent = dc.getParent();
        memory.put("parent", parent == null || parent.getActiveDialog() == null ? null : parent.getActiveDialog().getId());
        return memory;
    }
}
