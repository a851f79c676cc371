package com.jreinhal.colloquy.oauth;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.ConversationAccount;
import com.jreinhal.colloquy.dialogs.DialogConfigurationException;
import com.jreinhal.colloquy.turn.TurnContext;
import com.jreinhal.colloquy.util.LogSanitizer;
import com.nimbusds.jwt.JWTParser;
import java.text.ParseException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One turn of one auth handler's sign-in. The persisted {@link SignInHandlerState} decides
 * which step runs: begin sends the card, continue reads the reply, success re-reads the token
 * and failure resets the handler when the sign-in cannot be resumed.
 */
public class SignInContext {
    private static final Logger log = LoggerFactory.getLogger(SignInContext.class);

    static final String EXCHANGEABLE_AUDIENCE_PREFIX = "api://";

    enum FailureReason {
        TOKEN_NOT_RECEIVED("token was not received", false),
        NO_CONTINUATION_ACTIVITY("no continuation activity available", true),
        CONVERSATION_MISSING("conversation missing during the continuation flow", true),
        CONVERSATION_CHANGED("conversation changed during the continuation flow", true),
        FLOW_RESTARTED("flow was restarted", true);

        private final String description;
        private final boolean reset;

        FailureReason(String description, boolean reset) {
            this.description = description;
            this.reset = reset;
        }

        String message() {
            return "Failed to complete OAuth flow due to " + this.description + ".";
        }
    }

    private final SignInStorage storage;
    private final Map<String, AuthHandler> handlers;
    private final TurnContext context;
    private final String handlerId;
    private final OnBehalfOfExchanger onBehalfOfExchanger;
    private final Map<SignInHandlerState.Status, Supplier<TokenResponse>> steps = new EnumMap<>(SignInHandlerState.Status.class);

    private SignInHandlerState handler;
    private OAuthFlow flow;
    private Runnable onSuccess = () -> {};
    private Consumer<String> onFailure = message -> {};

    public SignInContext(SignInStorage storage, Map<String, AuthHandler> handlers, TurnContext context,
                         String handlerId, OnBehalfOfExchanger onBehalfOfExchanger) {
        this.storage = storage;
        this.handlers = handlers;
        this.context = context;
        this.handlerId = handlerId;
        this.onBehalfOfExchanger = onBehalfOfExchanger;
        this.steps.put(SignInHandlerState.Status.BEGIN, this::begin);
        this.steps.put(SignInHandlerState.Status.CONTINUE, this::continueFlow);
        this.steps.put(SignInHandlerState.Status.SUCCESS, this::success);
        this.steps.put(SignInHandlerState.Status.FAILURE, this::failure);
    }

    public SignInContext onSuccess(Runnable callback) {
        this.onSuccess = Objects.requireNonNull(callback);
        return this;
    }

    public SignInContext onFailure(Consumer<String> callback) {
        this.onFailure = Objects.requireNonNull(callback);
        return this;
    }

    /**
     * Runs the step for the handler's current status.
     *
     * @return the token when the sign-in is complete, otherwise an empty response
     */
    public TokenResponse getToken() {
        if (!loadHandler()) {
            return TokenResponse.empty();
        }
        TokenResponse response = this.steps.get(this.handler.getStatus()).get();
        return response == null ? TokenResponse.empty() : response;
    }

    public TokenResponse getUserToken() {
        if (!loadHandler()) {
            return TokenResponse.empty();
        }
        return this.flow.getUserToken(this.context);
    }

    /**
     * Returns the user's token, swapped for a downstream token when its audience is an
     * {@code api://} application id.
     */
    public TokenResponse exchangeToken(List<String> scopes) {
        if (!loadHandler()) {
            return TokenResponse.empty();
        }
        TokenResponse response = this.flow.getUserToken(this.context);
        if (response == null || !response.hasToken() || !isExchangeable(response.token())) {
            return response == null ? TokenResponse.empty() : response;
        }
        if (this.onBehalfOfExchanger == null) {
            throw new DialogConfigurationException("No on-behalf-of exchanger configured for handler " + this.handler.getId());
        }
        String exchanged = this.onBehalfOfExchanger.exchange(this.handler.getId(), response.token(), scopes);
        return new TokenResponse(response.channelId(), response.connectionName(), exchanged, null);
    }

    public void signOut() {
        if (!loadHandler()) {
            return;
        }
        this.storage.delete(this.context, this.handler.getId());
        this.flow.signOut(this.context);
    }

    /**
     * Current handler record, available after one of the public operations ran.
     */
    public SignInHandlerState getHandler() {
        return this.handler;
    }

    private boolean loadHandler() {
        SignInHandlerState loaded = this.handlerId != null
                ? this.storage.get(this.context, this.handlerId)
                : this.storage.active(this.context);
        if (loaded == null) {
            loaded = new SignInHandlerState(this.handlerId, SignInHandlerState.Status.BEGIN);
        }
        this.handler = loaded;
        if (loaded.getId() == null || loaded.getId().isBlank()) {
            return false;
        }
        AuthHandler authHandler = this.handlers.get(loaded.getId());
        if (authHandler == null) {
            throw new DialogConfigurationException("Cannot find auth handler with ID '" + loaded.getId() + "'. Ensure it is configured.");
        }
        this.flow = authHandler.flow();

        if (loaded.getStatus() == SignInHandlerState.Status.BEGIN) {
            FlowState flowState = this.flow.getFlowState(this.context);
            if (flowState.isFlowStarted()) {
                setStatus(SignInHandlerState.Status.SUCCESS);
                this.storage.set(this.context, this.handler);
                return true;
            }
            this.flow.signOut(this.context);
        } else {
            this.flow.setFlowState(this.context, loaded.getState() != null ? loaded.getState() : new FlowState());
        }
        return true;
    }

    private TokenResponse begin() {
        log.debug("Beginning sign-in for handler {}", LogSanitizer.sanitize(this.handler.getId()));
        TokenResponse response = this.flow.beginFlow(this.context);
        if (response != null && response.hasToken()) {
            setStatus(SignInHandlerState.Status.SUCCESS);
            this.storage.set(this.context, this.handler);
            this.onSuccess.run();
            return response;
        }
        setStatus(SignInHandlerState.Status.CONTINUE);
        this.storage.set(this.context, this.handler);
        return TokenResponse.empty();
    }

    private TokenResponse continueFlow() {
        TokenResponse response = this.flow.continueFlow(this.context);
        if (response != null && response.hasToken() && !response.token().isBlank()) {
            setStatus(SignInHandlerState.Status.SUCCESS);
            this.storage.set(this.context, this.handler);
            this.onSuccess.run();
            return response;
        }
        failure();
        return response;
    }

    private TokenResponse success() {
        TokenResponse response = this.flow.getUserToken(this.context);
        if (response != null && response.hasToken()) {
            return response;
        }
        return continueFlow();
    }

    private TokenResponse failure() {
        setStatus(SignInHandlerState.Status.FAILURE);
        FailureReason reason = classifyFailure();
        String message = reason.message();
        log.warn("{} Handler: {}", message, LogSanitizer.sanitize(this.handler.getId()));
        if (reason.reset) {
            this.flow.signOut(this.context);
            this.storage.delete(this.context, this.handler.getId());
        }
        this.onFailure.accept(message);
        return null;
    }

    private FailureReason classifyFailure() {
        Activity continuation = this.handler.getContinuationActivity();
        if (continuation == null) {
            return FailureReason.NO_CONTINUATION_ACTIVITY;
        }
        ConversationAccount previous = continuation.getConversation();
        ConversationAccount current = this.context.getActivity().getConversation();
        if (previous == null || previous.id() == null || current == null || current.id() == null) {
            return FailureReason.CONVERSATION_MISSING;
        }
        if (!previous.id().equals(current.id())) {
            return FailureReason.CONVERSATION_CHANGED;
        }
        if (this.handler.getState() == null || !this.handler.getState().isFlowStarted()) {
            return FailureReason.FLOW_RESTARTED;
        }
        return FailureReason.TOKEN_NOT_RECEIVED;
    }

    private void setStatus(SignInHandlerState.Status status) {
        switch (status) {
            case BEGIN -> this.handler = new SignInHandlerState(this.handler.getId(), status);
            case CONTINUE -> {
                SignInHandlerState next = new SignInHandlerState(this.handler, status);
                next.setState(this.flow.getFlowState(this.context));
                next.setContinuationActivity(this.context.getActivity());
                this.handler = next;
            }
            case SUCCESS -> {
                SignInHandlerState next = new SignInHandlerState(this.handler, status);
                next.setState(null);
                this.handler = next;
            }
            case FAILURE -> {
                SignInHandlerState next = new SignInHandlerState(this.handler, status);
                next.setState(this.flow.getFlowState(this.context));
                this.handler = next;
            }
        }
    }

    static boolean isExchangeable(String token) {
        try {
            List<String> audience = JWTParser.parse(token).getJWTClaimsSet().getAudience();
            return audience != null && !audience.isEmpty() && audience.get(0).startsWith(EXCHANGEABLE_AUDIENCE_PREFIX);
        } catch (ParseException e) {
            log.debug("Token is not a JWT, skipping exchange: {}", e.getMessage());
            return false;
        }
    }
}
