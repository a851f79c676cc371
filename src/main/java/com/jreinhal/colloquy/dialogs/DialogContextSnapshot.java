package com.jreinhal.colloquy.dialogs;

import java.util.List;

/**
 * Diagnostic copy of a context at the moment it failed.
 */
public record DialogContextSnapshot(String activeDialog, String parent, List<String> stack) {

    public static DialogContextSnapshot of(DialogContext dc) {
        DialogInstance active = dc.getActiveDialog();
        DialogContext parent = dc.getParent();
        DialogInstance parentActive = parent == null ? null : parent.getActiveDialog();
        List<String> stack = dc.getStack().stream().map(DialogInstance::getId).toList();
        return new DialogContextSnapshot(
                active == null ? null : active.getId(),
                parentActive == null ? null : parentActive.getId(),
                stack);
    }
}
