package com.jreinhal.colloquy.dialogs.memory;

import com.jreinhal.colloquy.dialogs.Dialog;
import com.jreinhal.colloquy.dialogs.DialogContainer;
import com.jreinhal.colloquy.dialogs.DialogContext;

/**
 * Like {@link ClassMemoryScope}, bound to the nearest container: the active dialog when it
 * is one, else the parent's active dialog, else the active dialog itself.
 */
public class DialogClassMemoryScope extends ClassMemoryScope {

    public DialogClassMemoryScope() {
        super(ScopePath.DIALOG_CLASS);
    }

    @Override
    protected Dialog onFindDialog(DialogContext dc) {
        Dialog dialog = dc.findDialog(dc.getActiveDialog().getId());
        if (dialog instanceof DialogContainer) {
            return dialog;
        }
        DialogContext parent = dc.getParent();
        if (parent != null && parent.getActiveDialog() != null) {
            Dialog parentDialog = parent.findDialog(parent.getActiveDialog().getId());
            if (parentDialog != null) {
                return parentDialog;
            }
        }
        return dialog;
    }
}
