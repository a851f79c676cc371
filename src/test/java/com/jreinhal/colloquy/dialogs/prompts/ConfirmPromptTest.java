package com.jreinhal.colloquy.dialogs.prompts;

import static org.junit.jupiter.api.Assertions.*;

import com.jreinhal.colloquy.TestActivities;
import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.dialogs.DialogContext;
import com.jreinhal.colloquy.dialogs.DialogSet;
import com.jreinhal.colloquy.dialogs.DialogState;
import com.jreinhal.colloquy.dialogs.DialogTurnResult;
import com.jreinhal.colloquy.dialogs.DialogTurnStatus;
import com.jreinhal.colloquy.dialogs.choices.Choice;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfirmPromptTest {

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

    private static Activity localized(String text, String locale) {
        Activity activity = TestActivities.message(text);
        activity.setLocale(locale);
        return activity;
    }

    private String ask(PromptOptions options) {
        DialogContext dc = turn(TestActivities.message("start"));
        dc.prompt("confirm", options);
        return dc.getContext().getSentActivities().get(0).getText();
    }

    private Object answer(Activity reply) {
        DialogTurnResult result = turn(reply).continueDialog();
        assertEquals(DialogTurnStatus.COMPLETE, result.status());
        return result.result();
    }

    @Test
    void rendersEnglishChoicesInline() {
        this.set.add(Prompts.confirm("confirm"));

        assertEquals("Continue? (1) Yes or (2) No", ask(PromptOptions.text("Continue?")));
    }

    @Test
    void recognizesYesAndNoWords() {
        this.set.add(Prompts.confirm("confirm"));
        ask(PromptOptions.text("Continue?"));
        assertEquals(Boolean.TRUE, answer(TestActivities.message("yes please")));

        ask(PromptOptions.text("Continue?"));
        assertEquals(Boolean.FALSE, answer(TestActivities.message("nope")));
    }

    @Test
    void recognizesChoiceNumbers() {
        this.set.add(Prompts.confirm("confirm"));
        ask(PromptOptions.text("Continue?"));

        assertEquals(Boolean.FALSE, answer(TestActivities.message("2")));
    }

    @Test
    void unrecognizedReplyRetries() {
        this.set.add(Prompts.confirm("confirm"));
        ask(PromptOptions.text("Continue?", "Please answer yes or no."));

        DialogContext retry = turn(TestActivities.message("maybe"));

        assertEquals(DialogTurnStatus.WAITING, retry.continueDialog().status());
        assertEquals("Please answer yes or no. (1) Yes or (2) No", retry.getContext().getSentActivities().get(0).getText());
    }

    @Test
    void activityLocaleSelectsTheCulture() {
        this.set.add(Prompts.confirm("confirm"));
        DialogContext dc = turn(localized("start", "fr-FR"));
        dc.prompt("confirm", PromptOptions.text("Continuer ?"));

        assertEquals("Continuer ? (1) Oui ou (2) Non", dc.getContext().getSentActivities().get(0).getText());
        assertEquals(Boolean.TRUE, answer(localized("oui", "fr-FR")));
    }

    @Test
    void defaultLocaleAppliesWhenTheActivityHasNone() {
        this.set.add(Prompts.confirm("confirm", null, "de-de"));

        assertEquals("Weiter? (1) Ja oder (2) Nein", ask(PromptOptions.text("Weiter?")));
        assertEquals(Boolean.FALSE, answer(TestActivities.message("nein")));
    }

    @Test
    void unsupportedLocaleFallsBackToEnglish() {
        this.set.add(Prompts.confirm("confirm", null, "xx-yy"));

        assertEquals("Continue? (1) Yes or (2) No", ask(PromptOptions.text("Continue?")));
    }

    @Test
    void customChoicesReplaceTheCultureDefaults() {
        ConfirmPromptSettings settings = new ConfirmPromptSettings()
                .setConfirmChoices(List.of(Choice.of("Sure"), Choice.of("Never")));
        this.set.add(Prompts.confirm("confirm", null, settings));

        assertEquals("Go? (1) Sure or (2) Never", ask(PromptOptions.text("Go?")));
        assertEquals(Boolean.FALSE, answer(TestActivities.message("never")));
    }

    @Test
    void confirmChoicesMustBeAPair() {
        ConfirmPromptSettings settings = new ConfirmPromptSettings();

        assertThrows(IllegalArgumentException.class, () -> settings.setConfirmChoices(List.of(Choice.of("Only"))));
    }

    @Test
    void listStyleNoneSendsThePromptAlone() {
        this.set.add(Prompts.confirm("confirm", null, new ConfirmPromptSettings().setStyle(ListStyle.NONE)));

        assertEquals("Continue?", ask(PromptOptions.text("Continue?")));
    }
}
