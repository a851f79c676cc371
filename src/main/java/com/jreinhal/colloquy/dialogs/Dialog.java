package com.jreinhal.colloquy.dialogs;

import com.jreinhal.colloquy.turn.TurnContext;

/**
 * A named, resumable unit of conversational behavior.
 *
 * <p>Dialog objects hold configuration only. Everything that must survive between turns
 * is kept in the {@link DialogInstance} frame the context pushes for each invocation.</p>
 */
public interface Dialog {

    String getId();

    /**
     * Reassigned by {@link DialogSet#add} when the id collides with another dialog.
     */
    void setId(String id);

    /**
     * Change-detection token; defaults to the id. Not part of the dialog's identity.
     */
    default String getVersion() {
        return getId();
    }

    /**
     * Called once, right after the frame for this dialog is pushed.
     */
    DialogTurnResult beginDialog(DialogContext dc, Object options);

    /**
     * Called on each later turn while this dialog is active. Ends immediately by default.
     */
    default DialogTurnResult continueDialog(DialogContext dc) {
        return dc.endDialog();
    }

    /**
     * Called when a child this dialog started has ended. By default the dialog ends too and
     * hands the child's result to its own caller.
     */
    default DialogTurnResult resumeDialog(DialogContext dc, DialogReason reason, Object result) {
        return dc.endDialog(result);
    }

    default void repromptDialog(TurnContext context, DialogInstance instance) {
    }

    /**
     * Cleanup hook run as the frame is popped.
     */
    default void endDialog(TurnContext context, DialogInstance instance, DialogReason reason) {
    }

    /**
     * Pre-bubble, bubble to the parent context, post-bubble. Each stage can stop propagation.
     *
     * @return true when some stage handled the event
     */
    default boolean onDialogEvent(DialogContext dc, DialogEvent event) {
        boolean handled = onPreBubbleEvent(dc, event);
        if (!handled && event.bubble() && dc.getParent() != null) {
            handled = dc.getParent().emitEvent(event.name(), event.value(), true, false);
        }
        if (!handled) {
            handled = onPostBubbleEvent(dc, event);
        }
        return handled;
    }

    default boolean onPreBubbleEvent(DialogContext dc, DialogEvent event) {
        return false;
    }

    default boolean onPostBubbleEvent(DialogContext dc, DialogEvent event) {
        return false;
    }
}
