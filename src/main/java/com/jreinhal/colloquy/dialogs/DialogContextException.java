package com.jreinhal.colloquy.dialogs;

/**
 * The persisted stack and the registered dialogs disagree, or a dialog failed while the
 * stack was being driven. Carries a snapshot of the context for diagnosis.
 */
public class DialogContextException extends RuntimeException {
    private final transient DialogContextSnapshot snapshot;

    public DialogContextException(String message, DialogContextSnapshot snapshot) {
        super(message);
        this.snapshot = snapshot;
    }

    public DialogContextException(String message, DialogContextSnapshot snapshot, Throwable cause) {
        super(message, cause);
        this.snapshot = snapshot;
    }

    public DialogContextSnapshot getSnapshot() {
        return this.snapshot;
    }
}
