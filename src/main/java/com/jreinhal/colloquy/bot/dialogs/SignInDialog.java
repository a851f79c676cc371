package com.jreinhal.colloquy.bot.dialogs;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.dialogs.ComponentDialog;
import com.jreinhal.colloquy.dialogs.DialogTurnResult;
import com.jreinhal.colloquy.dialogs.WaterfallDialog;
import com.jreinhal.colloquy.dialogs.WaterfallStepContext;
import com.jreinhal.colloquy.dialogs.prompts.OAuthPrompt;
import com.jreinhal.colloquy.dialogs.prompts.OAuthPromptSettings;
import com.jreinhal.colloquy.dialogs.prompts.PromptOptions;
import com.jreinhal.colloquy.dialogs.prompts.Prompts;
import com.jreinhal.colloquy.oauth.TokenResponse;
import com.jreinhal.colloquy.oauth.UserTokenClient;
import java.time.Clock;
import java.util.List;

/**
 * Signs the user in, then offers to show the token.
 */
public class SignInDialog extends ComponentDialog {
    public static final String ID = "signInDialog";

    static final String OAUTH_PROMPT = "oauthPrompt";
    static final String CONFIRM_PROMPT = "showTokenPrompt";

    public SignInDialog(OAuthPromptSettings settings, UserTokenClient userTokenClient, Clock clock) {
        super(ID);
        addDialog(new WaterfallDialog(ID + ".steps", List.of(
                this::promptStep,
                this::loginStep,
                this::displayTokenStep)));
        addDialog(new OAuthPrompt(OAUTH_PROMPT, settings, userTokenClient, clock));
        addDialog(Prompts.confirm(CONFIRM_PROMPT));
    }

    private DialogTurnResult promptStep(WaterfallStepContext step) {
        return step.beginDialog(OAUTH_PROMPT, null);
    }

    private DialogTurnResult loginStep(WaterfallStepContext step) {
        TokenResponse token = step.getResult(TokenResponse.class);
        if (token == null || !token.hasToken()) {
            step.getContext().sendActivity(Activity.message("Login was not successful please try again."));
            return step.endDialog(null);
        }
        step.getValues().put("token", token.token());
        step.getContext().sendActivity(Activity.message("You are now logged in."));
        return step.prompt(CONFIRM_PROMPT, PromptOptions.text("Would you like to view your token?"));
    }

    private DialogTurnResult displayTokenStep(WaterfallStepContext step) {
        String token = (String) step.getValues().get("token");
        if (Boolean.TRUE.equals(step.getResult(Boolean.class))) {
            step.getContext().sendActivity(Activity.message("Here is your token " + token));
        }
        return step.endDialog(token);
    }
}
