package com.jreinhal.colloquy.bot.dialogs;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.dialogs.ComponentDialog;
import com.jreinhal.colloquy.dialogs.DialogTurnResult;
import com.jreinhal.colloquy.dialogs.WaterfallDialog;
import com.jreinhal.colloquy.dialogs.WaterfallStepContext;
import java.util.List;

/**
 * Root of the sample conversation: "login" starts {@link SignInDialog} when one is configured,
 * anything else starts {@link UserProfileDialog}.
 */
public class MainDialog extends ComponentDialog {
    public static final String ID = "mainDialog";

    private final boolean signInEnabled;

    public MainDialog(UserProfileDialog profileDialog, SignInDialog signInDialog) {
        super(ID);
        addDialog(new WaterfallDialog(ID + ".steps", List.of(this::routeStep, this::finalStep)));
        addDialog(profileDialog);
        this.signInEnabled = signInDialog != null;
        if (signInDialog != null) {
            addDialog(signInDialog);
        }
    }

    private DialogTurnResult routeStep(WaterfallStepContext step) {
        String text = step.getContext().getActivity().getText();
        if (this.signInEnabled && text != null && "login".equalsIgnoreCase(text.trim())) {
            return step.beginDialog(SignInDialog.ID, null);
        }
        return step.beginDialog(UserProfileDialog.ID, null);
    }

    private DialogTurnResult finalStep(WaterfallStepContext step) {
        step.getContext().sendActivity(Activity.message("Type anything to start again."));
        return step.endDialog(step.getResult());
    }
}
