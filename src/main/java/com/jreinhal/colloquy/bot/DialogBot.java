package com.jreinhal.colloquy.bot;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.ActivityTypes;
import com.jreinhal.colloquy.dialogs.Dialog;
import com.jreinhal.colloquy.dialogs.DialogRunner;
import com.jreinhal.colloquy.dialogs.DialogState;
import com.jreinhal.colloquy.dialogs.DialogTurnResult;
import com.jreinhal.colloquy.dialogs.memory.MemoryScopes;
import com.jreinhal.colloquy.oauth.Authorization;
import com.jreinhal.colloquy.oauth.SignInResult;
import com.jreinhal.colloquy.state.ConversationState;
import com.jreinhal.colloquy.state.StatePropertyAccessor;
import com.jreinhal.colloquy.state.UserState;
import com.jreinhal.colloquy.turn.TurnContext;
import com.jreinhal.colloquy.util.LogSanitizer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Runs one inbound activity through the root dialog and persists conversation and user state.
 * When auth handlers are configured, {@code /signin <handler>} and {@code /signout [handler]}
 * drive them directly and a pending sign-in takes the turn before the dialogs do.
 */
@Service
public class DialogBot {
    private static final Logger log = LoggerFactory.getLogger(DialogBot.class);

    static final String SIGN_IN_COMMAND = "/signin";
    static final String SIGN_OUT_COMMAND = "/signout";

    private final ConversationState conversationState;
    private final UserState userState;
    private final Dialog rootDialog;
    private final Authorization authorization;
    private final StatePropertyAccessor<DialogState> dialogStateAccessor;
    private final MemoryScopes memoryScopes;

    public DialogBot(ConversationState conversationState, UserState userState, Dialog rootDialog,
                     ObjectProvider<Authorization> authorization) {
        this.conversationState = conversationState;
        this.userState = userState;
        this.rootDialog = rootDialog;
        this.authorization = authorization.getIfAvailable();
        this.dialogStateAccessor = conversationState.createProperty("dialogState", DialogState.class);
        this.memoryScopes = MemoryScopes.defaults().withAgentState(conversationState, userState);
        if (this.authorization != null) {
            this.authorization.onSignInSuccess((context, handlerId) ->
                    context.sendActivity(Activity.message("You are now signed in to " + handlerId + ".")));
            this.authorization.onSignInFailure((context, handlerId, message) ->
                    context.sendActivity(Activity.message(message)));
        }
    }

    /**
     * @return every activity sent during the turn, in order
     */
    public List<Activity> onTurn(Activity activity) {
        TurnContext context = new TurnContext(activity, sent ->
                log.debug("Turn {} sent {} activities", LogSanitizer.sanitize(activity.getId()), sent.size()));
        try {
            if (!handleAuthorization(context)) {
                DialogTurnResult result = DialogRunner.run(this.rootDialog, context, this.dialogStateAccessor, this.memoryScopes);
                log.debug("Dialog turn finished with status {}", result.status());
            }
        } finally {
            this.conversationState.saveChanges(context);
            this.userState.saveChanges(context);
        }
        return context.getSentActivities();
    }

    private boolean handleAuthorization(TurnContext context) {
        if (this.authorization == null) {
            return false;
        }
        Activity activity = context.getActivity();
        String text = activity.isType(ActivityTypes.MESSAGE) && activity.getText() != null ? activity.getText().trim() : "";
        if (text.startsWith(SIGN_OUT_COMMAND)) {
            String handlerId = text.substring(SIGN_OUT_COMMAND.length()).trim();
            this.authorization.signOut(context, handlerId.isEmpty() ? null : handlerId);
            context.sendActivity(Activity.message("You have been signed out."));
            return true;
        }
        if (text.startsWith(SIGN_IN_COMMAND)) {
            String handlerId = text.substring(SIGN_IN_COMMAND.length()).trim();
            if (handlerId.isEmpty()) {
                handlerId = this.authorization.getHandlerIds().iterator().next();
            }
            SignInResult result = this.authorization.beginOrContinueFlow(context, handlerId);
            log.debug("Sign-in for {} signed in: {}", LogSanitizer.sanitize(handlerId), result.isSignedIn());
            return true;
        }
        if (this.authorization.hasActiveFlow(context)) {
            this.authorization.beginOrContinueFlow(context, null);
            return true;
        }
        return false;
    }
}
