package com.jreinhal.colloquy.dialogs;

public enum DialogTurnStatus {
    /** The stack was empty when the turn ran. */
    EMPTY,
    /** The active dialog is suspended until the next turn. */
    WAITING,
    COMPLETE,
    CANCELLED,
    COMPLETE_AND_WAIT
}
