package com.jreinhal.colloquy.dialogs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;

/**
 * The persisted stack. Index 0 is the active frame.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DialogState {
    private List<DialogInstance> dialogStack = new ArrayList<>();

    public DialogState() {}

    public DialogState(List<DialogInstance> dialogStack) {
        setDialogStack(dialogStack);
    }

    public List<DialogInstance> getDialogStack() {
        return dialogStack;
    }

    public void setDialogStack(List<DialogInstance> dialogStack) {
        this.dialogStack = dialogStack == null ? new ArrayList<>() : new ArrayList<>(dialogStack);
    }
}
