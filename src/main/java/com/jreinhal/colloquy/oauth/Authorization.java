package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.dialogs.DialogConfigurationException;
import com.jreinhal.colloquy.storage.Storage;
import com.jreinhal.colloquy.turn.TurnContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of auth handlers. Entry point for agent code that needs a user token outside of a
 * dialog: each call builds a {@link SignInContext} for the turn and runs it.
 */
public class Authorization {
    private static final Logger log = LoggerFactory.getLogger(Authorization.class);

    private final Map<String, AuthHandler> handlers;
    private final SignInStorage signInStorage;
    private final OnBehalfOfExchanger onBehalfOfExchanger;
    private BiConsumer<TurnContext, String> signInSuccessHandler = (context, id) -> {};
    private SignInFailureHandler signInFailureHandler = (context, id, message) -> {};

    public Authorization(Storage storage, ObjectMapper objectMapper, Map<String, AuthHandler> handlers,
                         OnBehalfOfExchanger onBehalfOfExchanger) {
        if (storage == null) {
            throw new DialogConfigurationException("Storage is required for Authorization. Ensure that a storage is configured.");
        }
        if (handlers == null || handlers.isEmpty()) {
            throw new DialogConfigurationException("The authorization does not have any auth handlers");
        }
        for (Map.Entry<String, AuthHandler> entry : handlers.entrySet()) {
            String connectionName = entry.getValue().connectionName();
            if (connectionName == null || connectionName.isBlank()) {
                throw new DialogConfigurationException("Auth handler '" + entry.getKey() + "' requires a connection name");
            }
        }
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
        this.signInStorage = new SignInStorage(storage, objectMapper, this.handlers.keySet());
        this.onBehalfOfExchanger = onBehalfOfExchanger;
        log.info("Authorization configured with handlers {}", this.handlers.keySet());
    }

    public Set<String> getHandlerIds() {
        return this.handlers.keySet();
    }

    public AuthHandler resolveHandler(String handlerId) {
        AuthHandler handler = this.handlers.get(handlerId);
        if (handler == null) {
            throw new DialogConfigurationException("Cannot find auth handler with ID '" + handlerId + "'. Ensure it is configured.");
        }
        return handler;
    }

    /**
     * Token already held for the handler, without starting a sign-in.
     */
    public TokenResponse getToken(TurnContext context, String handlerId) {
        resolveHandler(handlerId);
        return newContext(context, handlerId).getUserToken();
    }

    public TokenResponse exchangeToken(TurnContext context, List<String> scopes, String handlerId) {
        resolveHandler(handlerId);
        return newContext(context, handlerId).exchangeToken(scopes);
    }

    /**
     * Advances the handler's sign-in by one turn. With a null id the first unfinished handler
     * is continued.
     */
    public SignInResult beginOrContinueFlow(TurnContext context, String handlerId) {
        if (handlerId != null) {
            resolveHandler(handlerId);
        }
        SignInContext signIn = newContext(context, handlerId);
        TokenResponse response = signIn.getToken();
        SignInHandlerState handler = signIn.getHandler();
        return new SignInResult(response == null ? null : response.token(), handler);
    }

    /**
     * True when some handler is waiting for the user's sign-in reply.
     */
    public boolean hasActiveFlow(TurnContext context) {
        return this.signInStorage.active(context) != null;
    }

    /**
     * Signs out of one handler, or of every handler when the id is blank.
     */
    public void signOut(TurnContext context, String handlerId) {
        if (handlerId == null || handlerId.isBlank()) {
            for (String id : this.handlers.keySet()) {
                newContext(context, id).signOut();
            }
            return;
        }
        resolveHandler(handlerId);
        newContext(context, handlerId).signOut();
    }

    public void onSignInSuccess(BiConsumer<TurnContext, String> handler) {
        this.signInSuccessHandler = handler;
    }

    public void onSignInFailure(SignInFailureHandler handler) {
        this.signInFailureHandler = handler;
    }

    private SignInContext newContext(TurnContext context, String handlerId) {
        SignInContext signIn = new SignInContext(this.signInStorage, this.handlers, context, handlerId, this.onBehalfOfExchanger);
        signIn.onSuccess(() -> this.signInSuccessHandler.accept(context, idOf(signIn, handlerId)));
        signIn.onFailure(message -> this.signInFailureHandler.onFailure(context, idOf(signIn, handlerId), message));
        return signIn;
    }

    private static String idOf(SignInContext signIn, String fallback) {
        SignInHandlerState handler = signIn.getHandler();
        return handler == null ? fallback : handler.getId();
    }
}
