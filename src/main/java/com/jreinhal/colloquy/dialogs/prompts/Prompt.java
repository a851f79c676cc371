package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.activity.ActivityTypes;
import com.jreinhal.colloquy.dialogs.AbstractDialog;
import com.jreinhal.colloquy.dialogs.DialogContext;
import com.jreinhal.colloquy.dialogs.DialogInstance;
import com.jreinhal.colloquy.dialogs.DialogReason;
import com.jreinhal.colloquy.dialogs.DialogTurnResult;
import com.jreinhal.colloquy.dialogs.StateValues;
import com.jreinhal.colloquy.turn.TurnContext;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ask, recognize, validate, retry. What is asked and how the answer is read come from the
 * injected {@link PromptRenderer} and {@link PromptRecognizer}; see {@link Prompts} for the
 * text and confirm variants.
 *
 * <p>The frame keeps the {@link PromptOptions} under {@code options} and the prompt's scratch
 * record, including {@code attemptCount}, under {@code state}.</p>
 */
public class Prompt<T> extends AbstractDialog {
    private static final Logger log = LoggerFactory.getLogger(Prompt.class);

    static final String PERSISTED_OPTIONS = "options";
    static final String PERSISTED_STATE = "state";
    static final String ATTEMPT_COUNT_KEY = "attemptCount";

    private final PromptRenderer renderer;
    private final PromptRecognizer<T> recognizer;
    private final PromptValidator<T> validator;
    private boolean endOnInvalidMessage;

    public Prompt(String id, PromptRenderer renderer, PromptRecognizer<T> recognizer, PromptValidator<T> validator) {
        super(id);
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.validator = validator;
    }

    /**
     * End with no result, instead of asking again, when a message fails recognition.
     */
    public Prompt<T> setEndOnInvalidMessage(boolean endOnInvalidMessage) {
        this.endOnInvalidMessage = endOnInvalidMessage;
        return this;
    }

    public boolean isEndOnInvalidMessage() {
        return this.endOnInvalidMessage;
    }

    @Override
    public DialogTurnResult beginDialog(DialogContext dc, Object options) {
        PromptOptions promptOptions = options == null ? new PromptOptions() : StateValues.convert(options, PromptOptions.class);
        Map<String, Object> frame = dc.getActiveDialog().getState();
        frame.put(PERSISTED_OPTIONS, promptOptions);
        Map<String, Object> state = StateValues.map(frame, PERSISTED_STATE);
        this.renderer.render(dc.getContext(), state, promptOptions, false);
        return DialogTurnResult.endOfTurn();
    }

    @Override
    public DialogTurnResult continueDialog(DialogContext dc) {
        TurnContext context = dc.getContext();
        if (!context.getActivity().isType(ActivityTypes.MESSAGE)) {
            return DialogTurnResult.endOfTurn();
        }
        Map<String, Object> frame = dc.getActiveDialog().getState();
        PromptOptions options = optionsOf(frame);
        Map<String, Object> state = StateValues.map(frame, PERSISTED_STATE);
        PromptRecognizerResult<T> recognized = this.recognizer.recognize(context, state, options);

        boolean isValid;
        if (this.validator != null) {
            int attemptCount = StateValues.intValue(state.get(ATTEMPT_COUNT_KEY), 0) + 1;
            state.put(ATTEMPT_COUNT_KEY, attemptCount);
            isValid = this.validator.validate(new PromptValidatorContext<>(context, recognized, state, options, attemptCount));
        } else {
            isValid = recognized.succeeded();
        }

        if (isValid) {
            return dc.endDialog(recognized.value());
        }
        if (this.endOnInvalidMessage) {
            log.debug("Prompt {} ended on invalid message", getId());
            return dc.endDialog();
        }
        if (!context.isResponded()) {
            this.renderer.render(context, state, options, true);
        }
        return DialogTurnResult.endOfTurn();
    }

    /**
     * A dialog this prompt started ended; the prompt asks its question again.
     */
    @Override
    public DialogTurnResult resumeDialog(DialogContext dc, DialogReason reason, Object result) {
        repromptDialog(dc.getContext(), dc.getActiveDialog());
        return DialogTurnResult.endOfTurn();
    }

    @Override
    public void repromptDialog(TurnContext context, DialogInstance instance) {
        Map<String, Object> frame = instance.getState();
        this.renderer.render(context, StateValues.map(frame, PERSISTED_STATE), optionsOf(frame), false);
    }

    public PromptRecognizer<T> getRecognizer() {
        return this.recognizer;
    }

    private static PromptOptions optionsOf(Map<String, Object> frame) {
        PromptOptions options = StateValues.get(frame, PERSISTED_OPTIONS, PromptOptions.class);
        return options == null ? new PromptOptions() : options;
    }
}
