package com.jreinhal.colloquy.dialogs;

import com.jreinhal.colloquy.activity.ActivityTypes;
import com.jreinhal.colloquy.turn.TurnContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed sequence of steps, one per turn or several per turn via
 * {@link WaterfallStepContext#next}. The frame records the current step, the options and
 * the values shared by the steps.
 */
public class WaterfallDialog extends AbstractDialog {
    private static final Logger log = LoggerFactory.getLogger(WaterfallDialog.class);

    static final String PERSISTED_OPTIONS = "options";
    static final String PERSISTED_VALUES = "values";
    static final String STEP_INDEX = "stepIndex";
    static final String INSTANCE_ID = "instanceId";

    private final List<WaterfallStep> steps = new ArrayList<>();

    public WaterfallDialog(String id) {
        this(id, List.of());
    }

    public WaterfallDialog(String id, List<WaterfallStep> steps) {
        super(id);
        this.steps.addAll(steps);
    }

    public WaterfallDialog addStep(WaterfallStep step) {
        this.steps.add(step);
        return this;
    }

    @Override
    public String getVersion() {
        return getId() + ":" + this.steps.size();
    }

    @Override
    public DialogTurnResult beginDialog(DialogContext dc, Object options) {
        Map<String, Object> state = dc.getActiveDialog().getState();
        state.put(PERSISTED_OPTIONS, options);
        state.put(PERSISTED_VALUES, new LinkedHashMap<String, Object>());
        state.put(INSTANCE_ID, UUID.randomUUID().toString());
        return runStep(dc, 0, DialogReason.BEGIN_CALLED, null);
    }

    /**
     * Only messages advance a waterfall; the text becomes the step result.
     */
    @Override
    public DialogTurnResult continueDialog(DialogContext dc) {
        if (!dc.getContext().getActivity().isType(ActivityTypes.MESSAGE)) {
            return DialogTurnResult.endOfTurn();
        }
        return resumeDialog(dc, DialogReason.CONTINUE_CALLED, dc.getContext().getActivity().getText());
    }

    @Override
    public DialogTurnResult resumeDialog(DialogContext dc, DialogReason reason, Object result) {
        Map<String, Object> state = dc.getActiveDialog().getState();
        int index = StateValues.intValue(state.get(STEP_INDEX), -1);
        return runStep(dc, index + 1, reason, result);
    }

    @Override
    public void endDialog(TurnContext context, DialogInstance instance, DialogReason reason) {
        log.debug("Waterfall {} ended at step {} ({})", getId(), instance.getState().get(STEP_INDEX), reason);
    }

    protected DialogTurnResult onStep(WaterfallStepContext step) {
        return this.steps.get(step.getIndex()).run(step);
    }

    private DialogTurnResult runStep(DialogContext dc, int index, DialogReason reason, Object result) {
        if (index >= this.steps.size()) {
            return dc.endDialog(result);
        }
        Map<String, Object> state = dc.getActiveDialog().getState();
        state.put(STEP_INDEX, index);
        WaterfallStepContext step = new WaterfallStepContext(this, dc, state.get(PERSISTED_OPTIONS),
                StateValues.map(state, PERSISTED_VALUES), index, reason, result);
        return onStep(step);
    }
}
