package com.jreinhal.colloquy.bot.dialogs;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.dialogs.ComponentDialog;
import com.jreinhal.colloquy.dialogs.DialogTurnResult;
import com.jreinhal.colloquy.dialogs.WaterfallDialog;
import com.jreinhal.colloquy.dialogs.WaterfallStepContext;
import com.jreinhal.colloquy.dialogs.prompts.PromptOptions;
import com.jreinhal.colloquy.dialogs.prompts.PromptValidatorContext;
import com.jreinhal.colloquy.dialogs.prompts.Prompts;
import com.jreinhal.colloquy.state.StatePropertyAccessor;
import com.jreinhal.colloquy.state.UserState;
import java.util.List;

/**
 * Asks for a name, optionally an age, and stores the result as the user's {@link UserProfile}.
 */
public class UserProfileDialog extends ComponentDialog {
    public static final String ID = "userProfileDialog";

    static final String NAME_PROMPT = "namePrompt";
    static final String CONFIRM_PROMPT = "confirmPrompt";
    static final String AGE_PROMPT = "agePrompt";

    private final StatePropertyAccessor<UserProfile> profileAccessor;

    public UserProfileDialog(UserState userState) {
        super(ID);
        this.profileAccessor = userState.createProperty("userProfile", UserProfile.class);

        addDialog(new WaterfallDialog(ID + ".steps", List.of(
                this::nameStep,
                this::ageConfirmStep,
                this::ageStep,
                this::summaryStep)));
        addDialog(Prompts.text(NAME_PROMPT));
        addDialog(Prompts.confirm(CONFIRM_PROMPT));
        addDialog(Prompts.text(AGE_PROMPT, UserProfileDialog::validateAge));
    }

    private DialogTurnResult nameStep(WaterfallStepContext step) {
        return step.prompt(NAME_PROMPT, PromptOptions.text("Please enter your name."));
    }

    private DialogTurnResult ageConfirmStep(WaterfallStepContext step) {
        step.getValues().put("name", step.getResult());
        step.getContext().sendActivity(Activity.message("Thanks " + step.getResult() + "."));
        return step.prompt(CONFIRM_PROMPT, PromptOptions.text("Would you like to give your age?"));
    }

    private DialogTurnResult ageStep(WaterfallStepContext step) {
        if (Boolean.TRUE.equals(step.getResult(Boolean.class))) {
            return step.prompt(AGE_PROMPT, PromptOptions.text("Please enter your age.",
                    "The value entered must be a number greater than 0 and less than 150."));
        }
        return step.next(null);
    }

    private DialogTurnResult summaryStep(WaterfallStepContext step) {
        Object answer = step.getResult();
        Integer age = answer == null ? null : Integer.valueOf(answer.toString().trim());
        UserProfile profile = new UserProfile((String) step.getValues().get("name"), age);
        this.profileAccessor.set(step.getContext(), profile);

        String summary = age == null
                ? "I have your name as " + profile.getName() + " and no age."
                : "I have your name as " + profile.getName() + " and your age as " + age + ".";
        step.getContext().sendActivity(Activity.message(summary));
        return step.endDialog(profile);
    }

    static boolean validateAge(PromptValidatorContext<String> prompt) {
        if (!prompt.recognized().succeeded()) {
            return false;
        }
        try {
            int age = Integer.parseInt(prompt.recognized().value().trim());
            return age > 0 && age < 150;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
