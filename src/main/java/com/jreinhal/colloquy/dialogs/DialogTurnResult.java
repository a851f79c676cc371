package com.jreinhal.colloquy.dialogs;

/**
 * Outcome of running the stack for one turn.
 *
 * @param status whether the stack suspended, completed, was cancelled or was empty
 * @param result value returned by the dialog that ended, if any
 */
public record DialogTurnResult(DialogTurnStatus status, Object result) {

    private static final DialogTurnResult END_OF_TURN = new DialogTurnResult(DialogTurnStatus.WAITING, null);

    public DialogTurnResult(DialogTurnStatus status) {
        this(status, null);
    }

    /**
     * Suspend the active dialog: state is persisted and the turn ends.
     */
    public static DialogTurnResult endOfTurn() {
        return END_OF_TURN;
    }

    public boolean isWaiting() {
        return this.status == DialogTurnStatus.WAITING;
    }
}
