package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.Attachment;
import com.jreinhal.colloquy.activity.CardFactory;
import com.jreinhal.colloquy.dialogs.DialogConfigurationException;
import com.jreinhal.colloquy.storage.Storage;
import com.jreinhal.colloquy.turn.TurnContext;
import com.jreinhal.colloquy.util.LogSanitizer;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sign-in for one connection, driven turn by turn. {@link #beginFlow} sends the sign-in card;
 * {@link #continueFlow} reads the magic code, verify-state or token-exchange reply on a later
 * turn. Progress is persisted as a {@link FlowState} per channel, conversation and user.
 */
public class OAuthFlow {
    private static final Logger log = LoggerFactory.getLogger(OAuthFlow.class);

    static final long FLOW_TIMEOUT_MS = 30_000L;
    static final String EXPIRED_MESSAGE = "Sign-in session expired. Please try again.";

    private final Storage storage;
    private final UserTokenClient userTokenClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String connectionName;
    private final String cardTitle;
    private final String cardText;

    public OAuthFlow(Storage storage, UserTokenClient userTokenClient, ObjectMapper objectMapper, Clock clock,
                     String connectionName, String cardTitle, String cardText) {
        this.storage = storage;
        this.userTokenClient = userTokenClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.connectionName = connectionName;
        this.cardTitle = cardTitle == null ? "Sign in" : cardTitle;
        this.cardText = cardText == null ? "login" : cardText;
    }

    public String getConnectionName() {
        return this.connectionName;
    }

    public TokenResponse getUserToken(TurnContext context) {
        Activity activity = context.getActivity();
        if (activity.getChannelId() == null || activity.getFrom() == null || activity.getFrom().id() == null) {
            throw new IllegalStateException("UserTokenService requires channelId and from to be set");
        }
        return this.userTokenClient.getUserToken(this.connectionName, activity.getChannelId(), activity.getFrom().id(), null);
    }

    /**
     * @return the token when the user already has one, otherwise null after the sign-in card was sent
     */
    public TokenResponse beginFlow(TurnContext context) {
        if (this.connectionName == null || this.connectionName.isBlank()) {
            throw new DialogConfigurationException("connectionName is not set");
        }
        FlowState state = getFlowState(context);
        log.info("Starting OAuth flow for connection {}", LogSanitizer.sanitize(this.connectionName));
        Activity activity = context.getActivity();
        TokenOrSignInResourceResponse output = this.userTokenClient.getTokenOrSignInResource(
                activity.getFrom().id(), this.connectionName, activity.getChannelId(),
                activity.getConversationReference(), activity.getRelatesTo(), null);
        if (output != null && output.tokenResponse() != null && output.tokenResponse().hasToken()) {
            state.setFlowStarted(false);
            state.setFlowExpires(0);
            setFlowState(context, state);
            return output.tokenResponse();
        }
        SignInResource resource = output == null ? null : output.signInResource();
        Attachment card = resource == null
                ? CardFactory.oauthCard(this.connectionName, this.cardTitle, this.cardText, null, null, null)
                : CardFactory.oauthCard(this.connectionName, this.cardTitle, this.cardText, resource.signInLink(),
                        resource.tokenExchangeResource(), resource.tokenPostResource());
        context.sendActivity(Activity.attachment(card));
        state.setFlowStarted(true);
        state.setFlowExpires(this.clock.millis() + FLOW_TIMEOUT_MS);
        setFlowState(context, state);
        return null;
    }

    /**
     * @return the token, or {@link TokenResponse#empty()} when this turn did not complete the sign-in
     */
    public TokenResponse continueFlow(TurnContext context) {
        FlowState state = getFlowState(context);
        if (state.getFlowExpires() != 0 && this.clock.millis() > state.getFlowExpires()) {
            log.warn("OAuth flow expired for connection {}", LogSanitizer.sanitize(this.connectionName));
            state.setFlowStarted(false);
            setFlowState(context, state);
            context.sendActivity(Activity.message(EXPIRED_MESSAGE));
            return TokenResponse.empty();
        }
        Activity activity = context.getActivity();
        String channelId = activity.getChannelId();
        String userId = activity.getFrom() == null ? null : activity.getFrom().id();
        switch (SignInActivityKind.classify(activity)) {
            case MESSAGE -> {
                return this.userTokenClient.getUserToken(this.connectionName, channelId, userId, activity.getText());
            }
            case VERIFY_STATE_INVOKE -> {
                log.info("Continuing OAuth flow with verifyState");
                Map<String, Object> value = activity.getValueAsMap();
                String magicCode = value == null || value.get("state") == null ? null : value.get("state").toString();
                return this.userTokenClient.getUserToken(this.connectionName, channelId, userId, magicCode);
            }
            case TOKEN_EXCHANGE_INVOKE -> {
                log.info("Continuing OAuth flow with tokenExchange");
                return exchange(context, state, channelId, userId);
            }
            default -> {
                return TokenResponse.empty();
            }
        }
    }

    private TokenResponse exchange(TurnContext context, FlowState state, String channelId, String userId) {
        Object value = context.getActivity().getValue();
        TokenExchangeRequest request = value == null ? new TokenExchangeRequest(null, null, null)
                : this.objectMapper.convertValue(value, TokenExchangeRequest.class);
        if (request.id() != null && request.id().equals(state.getTokenExchangeId())) {
            log.debug("Ignoring repeated token exchange request {}", LogSanitizer.sanitize(request.id()));
            return TokenResponse.empty();
        }
        state.setTokenExchangeId(request.id());
        TokenResponse response = this.userTokenClient.exchangeToken(userId, this.connectionName, channelId, request);
        if (response != null && response.hasToken()) {
            log.info("Token exchanged for connection {}", LogSanitizer.sanitize(this.connectionName));
            state.setFlowStarted(false);
            setFlowState(context, state);
            return response;
        }
        log.warn("Token exchange failed for connection {}", LogSanitizer.sanitize(this.connectionName));
        state.setFlowStarted(true);
        setFlowState(context, state);
        return TokenResponse.empty();
    }

    public void signOut(TurnContext context) {
        FlowState state = getFlowState(context);
        Activity activity = context.getActivity();
        this.userTokenClient.signOut(activity.getFrom() == null ? null : activity.getFrom().id(), this.connectionName, activity.getChannelId());
        state.setFlowExpires(0);
        setFlowState(context, state);
        log.info("User signed out of connection {}", LogSanitizer.sanitize(this.connectionName));
    }

    public FlowState getFlowState(TurnContext context) {
        String key = flowStateKey(context);
        Object stored = this.storage.read(List.of(key)).get(key);
        return stored == null ? new FlowState() : this.objectMapper.convertValue(stored, FlowState.class);
    }

    public void setFlowState(TurnContext context, FlowState state) {
        this.storage.write(Map.of(flowStateKey(context), state == null ? new FlowState() : state));
    }

    static String flowStateKey(TurnContext context) {
        Activity activity = context.getActivity();
        String channelId = activity.getChannelId();
        String conversationId = activity.getConversation() == null ? null : activity.getConversation().id();
        String userId = activity.getFrom() == null ? null : activity.getFrom().id();
        if (isBlank(channelId) || isBlank(conversationId) || isBlank(userId)) {
            throw new IllegalStateException("ChannelId, conversationId, and userId must be set in the activity");
        }
        return "oauth/" + channelId + "/" + conversationId + "/" + userId + "/flowState";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
