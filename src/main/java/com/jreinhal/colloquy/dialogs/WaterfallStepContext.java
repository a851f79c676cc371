package com.jreinhal.colloquy.dialogs;

import com.jreinhal.colloquy.dialogs.prompts.PromptOptions;
import com.jreinhal.colloquy.turn.TurnContext;
import java.util.Map;

/**
 * What a waterfall step sees: the step's position, the result of the previous step, the
 * waterfall's options and the values shared by all steps of this run, plus the stack
 * operations of the underlying context.
 */
public class WaterfallStepContext {
    private final WaterfallDialog parent;
    private final DialogContext dc;
    private final Object options;
    private final Map<String, Object> values;
    private final int index;
    private final DialogReason reason;
    private final Object result;
    private boolean nextCalled;

    WaterfallStepContext(WaterfallDialog parent, DialogContext dc, Object options, Map<String, Object> values,
                         int index, DialogReason reason, Object result) {
        this.parent = parent;
        this.dc = dc;
        this.options = options;
        this.values = values;
        this.index = index;
        this.reason = reason;
        this.result = result;
    }

    public DialogContext getDialogContext() {
        return this.dc;
    }

    public TurnContext getContext() {
        return this.dc.getContext();
    }

    public int getIndex() {
        return this.index;
    }

    public DialogReason getReason() {
        return this.reason;
    }

    public Object getResult() {
        return this.result;
    }

    public <T> T getResult(Class<T> type) {
        return StateValues.convert(this.result, type);
    }

    public Object getOptions() {
        return this.options;
    }

    public <T> T getOptions(Class<T> type) {
        return StateValues.convert(this.options, type);
    }

    /**
     * Shared across every step of this waterfall run and persisted with the frame.
     */
    public Map<String, Object> getValues() {
        return this.values;
    }

    /**
     * Skips to the following step with {@code result}. Only once per step.
     */
    public DialogTurnResult next(Object result) {
        if (this.nextCalled) {
            throw new IllegalStateException("WaterfallStepContext.next(): method already called for dialog and step '"
                    + this.parent.getId() + "[" + this.index + "]'");
        }
        this.nextCalled = true;
        return this.parent.resumeDialog(this.dc, DialogReason.NEXT_CALLED, result);
    }

    public DialogTurnResult next() {
        return next(null);
    }

    public DialogTurnResult beginDialog(String dialogId, Object options) {
        return this.dc.beginDialog(dialogId, options);
    }

    public DialogTurnResult prompt(String dialogId, PromptOptions options) {
        return this.dc.prompt(dialogId, options);
    }

    public DialogTurnResult endDialog(Object result) {
        return this.dc.endDialog(result);
    }

    public DialogTurnResult replaceDialog(String dialogId, Object options) {
        return this.dc.replaceDialog(dialogId, options);
    }

    public DialogTurnResult cancelAllDialogs() {
        return this.dc.cancelAllDialogs();
    }
}
