package com.jreinhal.colloquy.dialogs;

import com.jreinhal.colloquy.turn.TurnContext;

/**
 * A container whose private stack starts with {@link #getInitialDialogId()} and which ends,
 * with the inner result, as soon as the inner stack completes.
 */
public class ComponentDialog extends DialogContainer {
    static final String PERSISTED_DIALOG_STATE = "dialogs";

    private String initialDialogId;

    public ComponentDialog(String id) {
        super(id);
    }

    /**
     * Registers an inner dialog. The first one added becomes the initial dialog unless one
     * was set explicitly.
     */
    public ComponentDialog addDialog(Dialog dialog) {
        this.dialogs.add(dialog);
        if (this.initialDialogId == null) {
            this.initialDialogId = dialog.getId();
        }
        return this;
    }

    public String getInitialDialogId() {
        return this.initialDialogId;
    }

    public void setInitialDialogId(String initialDialogId) {
        this.initialDialogId = initialDialogId;
    }

    @Override
    public DialogTurnResult beginDialog(DialogContext outerDc, Object options) {
        DialogContext innerDc = createChildContext(outerDc);
        DialogTurnResult turnResult = onBeginDialog(innerDc, options);
        if (turnResult.status() != DialogTurnStatus.WAITING) {
            return endComponent(outerDc, turnResult.result());
        }
        return DialogTurnResult.endOfTurn();
    }

    @Override
    public DialogTurnResult continueDialog(DialogContext outerDc) {
        DialogContext innerDc = createChildContext(outerDc);
        DialogTurnResult turnResult = onContinueDialog(innerDc);
        if (turnResult.status() != DialogTurnStatus.WAITING) {
            return endComponent(outerDc, turnResult.result());
        }
        return DialogTurnResult.endOfTurn();
    }

    /**
     * Something this component started on the outer stack ended. The inner stack is still
     * waiting, so ask again.
     */
    @Override
    public DialogTurnResult resumeDialog(DialogContext outerDc, DialogReason reason, Object result) {
        repromptDialog(outerDc.getContext(), outerDc.getActiveDialog());
        return DialogTurnResult.endOfTurn();
    }

    @Override
    public void repromptDialog(TurnContext context, DialogInstance instance) {
        DialogContext innerDc = new DialogContext(this.dialogs, context, innerState(instance));
        innerDc.repromptDialog();
        onRepromptDialog(context, instance);
    }

    @Override
    public void endDialog(TurnContext context, DialogInstance instance, DialogReason reason) {
        if (reason == DialogReason.CANCEL_CALLED) {
            DialogContext innerDc = new DialogContext(this.dialogs, context, innerState(instance));
            innerDc.cancelAllDialogs();
        }
        onEndDialog(context, instance, reason);
    }

    @Override
    public DialogContext createChildContext(DialogContext dc) {
        DialogInstance instance = dc.getActiveDialog();
        if (instance == null) {
            return null;
        }
        return new DialogContext(this.dialogs, dc, innerState(instance));
    }

    protected DialogTurnResult onBeginDialog(DialogContext innerDc, Object options) {
        if (this.initialDialogId == null) {
            throw new DialogConfigurationException("ComponentDialog '" + getId() + "' has no initial dialog");
        }
        return innerDc.beginDialog(this.initialDialogId, options);
    }

    protected DialogTurnResult onContinueDialog(DialogContext innerDc) {
        return innerDc.continueDialog();
    }

    protected void onRepromptDialog(TurnContext context, DialogInstance instance) {
    }

    protected void onEndDialog(TurnContext context, DialogInstance instance, DialogReason reason) {
    }

    protected DialogTurnResult endComponent(DialogContext outerDc, Object result) {
        return outerDc.endDialog(result);
    }

    private static DialogState innerState(DialogInstance instance) {
        DialogState state = StateValues.get(instance.getState(), PERSISTED_DIALOG_STATE, DialogState.class);
        if (state == null) {
            state = new DialogState();
            instance.getState().put(PERSISTED_DIALOG_STATE, state);
        }
        return state;
    }
}
