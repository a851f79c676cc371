package com.jreinhal.colloquy.dialogs.prompts;

import static org.junit.jupiter.api.Assertions.*;

import com.jreinhal.colloquy.TestActivities;
import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.InputHints;
import com.jreinhal.colloquy.dialogs.DialogContext;
import com.jreinhal.colloquy.dialogs.DialogSet;
import com.jreinhal.colloquy.dialogs.DialogState;
import com.jreinhal.colloquy.dialogs.DialogTurnResult;
import com.jreinhal.colloquy.dialogs.DialogTurnStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TextPromptTest {

    private DialogSet set;
    private DialogState state;

    @BeforeEach
    void setUp() {
        this.set = new DialogSet();
        this.state = new DialogState();
    }

    private DialogContext turn(Activity activity) {
        return new DialogContext(this.set, TestActivities.turn(activity), this.state);
    }

    @Test
    void asksThenReturnsTheReply() {
        this.set.add(Prompts.text("name"));
        DialogContext first = turn(TestActivities.message("hi"));

        DialogTurnResult waiting = first.prompt("name", PromptOptions.text("What is your name?"));
        DialogTurnResult done = turn(TestActivities.message("hello")).continueDialog();

        assertEquals(DialogTurnStatus.WAITING, waiting.status());
        Activity asked = first.getContext().getSentActivities().get(0);
        assertEquals("What is your name?", asked.getText());
        assertEquals(InputHints.EXPECTING_INPUT, asked.getInputHint());
        assertEquals(DialogTurnStatus.COMPLETE, done.status());
        assertEquals("hello", done.result());
    }

    @Test
    void emptyReplyRetries() {
        this.set.add(Prompts.text("name"));
        turn(TestActivities.message("hi")).prompt("name", PromptOptions.text("Name?", "Please type your name."));

        DialogContext retry = turn(TestActivities.message(""));
        DialogTurnResult result = retry.continueDialog();

        assertEquals(DialogTurnStatus.WAITING, result.status());
        assertEquals("Please type your name.", retry.getContext().getSentActivities().get(0).getText());
    }

    @Test
    void retryRepliesToTheCurrentTurn() {
        this.set.add(Prompts.text("name"));
        PromptOptions options = PromptOptions.text("Name?", "Please type your name.");
        turn(TestActivities.message("hi")).prompt("name", options);

        Activity reply = TestActivities.message("");
        DialogContext retry = turn(reply);
        retry.continueDialog();

        Activity sent = retry.getContext().getSentActivities().get(0);
        assertEquals(reply.getId(), sent.getReplyToId());
        assertNull(options.getRetryPrompt().getReplyToId());
        assertNull(options.getPrompt().getReplyToId());
    }

    @Test
    void validatorSeesAttemptCount() {
        this.set.add(Prompts.text("code", ctx -> ctx.recognized().succeeded() && ctx.attemptCount() >= 2));
        turn(TestActivities.message("hi")).prompt("code", PromptOptions.text("Code?"));

        DialogContext firstAttempt = turn(TestActivities.message("a"));
        assertEquals(DialogTurnStatus.WAITING, firstAttempt.continueDialog().status());
        assertEquals("Code?", firstAttempt.getContext().getSentActivities().get(0).getText());

        DialogTurnResult second = turn(TestActivities.message("b")).continueDialog();
        assertEquals("b", second.result());
    }

    @Test
    void endsWithoutResultWhenConfiguredToEndOnInvalidMessage() {
        this.set.add(Prompts.text("name").setEndOnInvalidMessage(true));
        turn(TestActivities.message("hi")).prompt("name", PromptOptions.text("Name?"));

        DialogTurnResult result = turn(TestActivities.message("")).continueDialog();

        assertEquals(DialogTurnStatus.COMPLETE, result.status());
        assertNull(result.result());
    }

    @Test
    void ignoresNonMessageActivities() {
        this.set.add(Prompts.text("name"));
        turn(TestActivities.message("hi")).prompt("name", PromptOptions.text("Name?"));

        DialogContext event = turn(TestActivities.event("typing", null));

        assertEquals(DialogTurnStatus.WAITING, event.continueDialog().status());
        assertTrue(event.getContext().getSentActivities().isEmpty());
    }

    @Test
    void repromptAsksAgain() {
        this.set.add(Prompts.text("name"));
        turn(TestActivities.message("hi")).prompt("name", PromptOptions.text("Name?"));

        DialogContext again = turn(TestActivities.message("x"));
        again.repromptDialog();

        assertEquals("Name?", again.getContext().getSentActivities().get(0).getText());
    }
}
