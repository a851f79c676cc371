package com.jreinhal.colloquy.dialogs;

/**
 * Why a dialog is being started, resumed or ended.
 */
public enum DialogReason {
    BEGIN_CALLED,
    CONTINUE_CALLED,
    END_CALLED,
    REPLACE_CALLED,
    CANCEL_CALLED,
    NEXT_CALLED
}
