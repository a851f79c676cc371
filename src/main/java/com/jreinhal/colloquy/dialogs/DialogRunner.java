package com.jreinhal.colloquy.dialogs;

import com.jreinhal.colloquy.dialogs.memory.MemoryScopes;
import com.jreinhal.colloquy.state.StatePropertyAccessor;
import com.jreinhal.colloquy.turn.TurnContext;

/**
 * Drives a root dialog for one turn: continue the persisted stack, or begin the dialog
 * when the stack is empty.
 */
public final class DialogRunner {

    private DialogRunner() {
    }

    public static DialogTurnResult run(Dialog dialog, TurnContext context, StatePropertyAccessor<DialogState> accessor) {
        return run(dialog, context, accessor, MemoryScopes.defaults());
    }

    public static DialogTurnResult run(Dialog dialog, TurnContext context, StatePropertyAccessor<DialogState> accessor,
                                       MemoryScopes memoryScopes) {
        DialogSet dialogSet = new DialogSet(accessor).setMemoryScopes(memoryScopes);
        dialogSet.add(dialog);
        DialogContext dc = dialogSet.createContext(context);
        DialogTurnResult result = dc.continueDialog();
        if (result.status() == DialogTurnStatus.EMPTY) {
            result = dc.beginDialog(dialog.getId());
        }
        return result;
    }
}
