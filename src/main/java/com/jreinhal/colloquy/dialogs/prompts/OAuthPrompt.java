package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.Attachment;
import com.jreinhal.colloquy.activity.CardFactory;
import com.jreinhal.colloquy.activity.InputHints;
import com.jreinhal.colloquy.dialogs.AbstractDialog;
import com.jreinhal.colloquy.dialogs.DialogConfigurationException;
import com.jreinhal.colloquy.dialogs.DialogContext;
import com.jreinhal.colloquy.dialogs.DialogTurnResult;
import com.jreinhal.colloquy.dialogs.StateValues;
import com.jreinhal.colloquy.oauth.SignInActivityKind;
import com.jreinhal.colloquy.oauth.SignInResource;
import com.jreinhal.colloquy.oauth.TokenExchangeInvokeRequest;
import com.jreinhal.colloquy.oauth.TokenExchangeInvokeResponse;
import com.jreinhal.colloquy.oauth.TokenExchangeRequest;
import com.jreinhal.colloquy.oauth.TokenResponse;
import com.jreinhal.colloquy.oauth.UserTokenClient;
import com.jreinhal.colloquy.turn.TurnContext;
import com.jreinhal.colloquy.util.LogSanitizer;
import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the user to sign in and ends with their {@link TokenResponse}, or with null when the
 * sign-in times out. The token can arrive as a {@code tokens/response} event, a
 * {@code signin/verifyState} or {@code signin/tokenExchange} invoke, or a six-digit magic code
 * typed into the chat.
 */
public class OAuthPrompt extends AbstractDialog {
    private static final Logger log = LoggerFactory.getLogger(OAuthPrompt.class);

    public static final long DEFAULT_TIMEOUT_MS = 900_000L;

    static final String PERSISTED_OPTIONS = "options";
    static final String PERSISTED_STATE = "state";
    static final String PERSISTED_EXPIRES = "expires";
    static final String ATTEMPT_COUNT_KEY = "attemptCount";

    static final String EXCHANGE_FAILED_DETAIL = "The bot is unable to exchange token. Proceed with regular login.";
    private static final Pattern MAGIC_CODE = Pattern.compile("(?<!\\d)(\\d{6})(?!\\d)");

    private final OAuthPromptSettings settings;
    private final UserTokenClient userTokenClient;
    private final Clock clock;
    private final PromptValidator<TokenResponse> validator;
    private final Map<SignInActivityKind, Function<TurnContext, PromptRecognizerResult<TokenResponse>>> recognizers =
            new EnumMap<>(SignInActivityKind.class);

    public OAuthPrompt(String id, OAuthPromptSettings settings, UserTokenClient userTokenClient, Clock clock) {
        this(id, settings, userTokenClient, clock, null);
    }

    public OAuthPrompt(String id, OAuthPromptSettings settings, UserTokenClient userTokenClient, Clock clock,
                       PromptValidator<TokenResponse> validator) {
        super(id);
        if (settings == null || settings.connectionName() == null || settings.connectionName().isBlank()) {
            throw new DialogConfigurationException("OAuthPrompt '" + id + "' requires a connection name");
        }
        this.settings = settings;
        this.userTokenClient = userTokenClient;
        this.clock = clock;
        this.validator = validator;
        this.recognizers.put(SignInActivityKind.TOKEN_RESPONSE_EVENT, this::recognizeTokenResponseEvent);
        this.recognizers.put(SignInActivityKind.VERIFY_STATE_INVOKE, this::recognizeVerifyState);
        this.recognizers.put(SignInActivityKind.TOKEN_EXCHANGE_INVOKE, this::recognizeTokenExchange);
        this.recognizers.put(SignInActivityKind.MESSAGE, this::recognizeMagicCode);
    }

    @Override
    public DialogTurnResult beginDialog(DialogContext dc, Object options) {
        PromptOptions promptOptions = options == null ? new PromptOptions() : StateValues.convert(options, PromptOptions.class);
        if (promptOptions.getPrompt() != null && promptOptions.getPrompt().getInputHint() == null) {
            promptOptions.getPrompt().setInputHint(InputHints.ACCEPTING_INPUT);
        }
        if (promptOptions.getRetryPrompt() != null && promptOptions.getRetryPrompt().getInputHint() == null) {
            promptOptions.getRetryPrompt().setInputHint(InputHints.ACCEPTING_INPUT);
        }

        Map<String, Object> frame = dc.getActiveDialog().getState();
        frame.put(PERSISTED_STATE, new LinkedHashMap<String, Object>());
        frame.put(PERSISTED_OPTIONS, promptOptions);
        frame.put(PERSISTED_EXPIRES, this.clock.millis() + this.settings.effectiveTimeoutMs());

        TokenResponse output = getUserToken(dc.getContext(), null);
        if (output != null && output.hasToken()) {
            log.debug("OAuthPrompt {} found an existing token", getId());
            return dc.endDialog(output);
        }
        sendOAuthCard(dc.getContext(), promptOptions.getPrompt());
        return DialogTurnResult.endOfTurn();
    }

    @Override
    public DialogTurnResult continueDialog(DialogContext dc) {
        TurnContext context = dc.getContext();
        SignInActivityKind kind = SignInActivityKind.classify(context.getActivity());
        boolean isMessage = kind == SignInActivityKind.MESSAGE;
        Map<String, Object> frame = dc.getActiveDialog().getState();

        long expires = StateValues.longValue(frame.get(PERSISTED_EXPIRES), 0L);
        if (kind != SignInActivityKind.UNHANDLED && this.clock.millis() > expires) {
            log.info("OAuthPrompt {} timed out", getId());
            return dc.endDialog();
        }

        PromptRecognizerResult<TokenResponse> recognized = this.recognizers
                .getOrDefault(kind, ctx -> PromptRecognizerResult.failure())
                .apply(context);
        Map<String, Object> state = StateValues.map(frame, PERSISTED_STATE);
        state.putIfAbsent(ATTEMPT_COUNT_KEY, 0);
        PromptOptions options = StateValues.get(frame, PERSISTED_OPTIONS, PromptOptions.class);
        if (options == null) {
            options = new PromptOptions();
        }

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
        if (isMessage && this.settings.endOnInvalidMessage()) {
            return dc.endDialog();
        }
        if (!context.isResponded() && isMessage && options.getRetryPrompt() != null) {
            context.sendActivity(options.getRetryPrompt().copy());
        }
        return DialogTurnResult.endOfTurn();
    }

    /**
     * Token already held by the user, or redeemed with {@code code}.
     */
    public TokenResponse getUserToken(TurnContext context, String code) {
        Activity activity = context.getActivity();
        if (activity.getChannelId() == null || activity.getFrom() == null || activity.getFrom().id() == null) {
            throw new IllegalStateException("OAuthPrompt requires channelId and from.id on the activity");
        }
        return this.userTokenClient.getUserToken(this.settings.connectionName(), activity.getChannelId(),
                activity.getFrom().id(), code);
    }

    public void signOutUser(TurnContext context) {
        Activity activity = context.getActivity();
        this.userTokenClient.signOut(activity.getFrom() == null ? null : activity.getFrom().id(),
                this.settings.connectionName(), activity.getChannelId());
    }

    void sendOAuthCard(TurnContext context, Activity prompt) {
        Activity message = prompt != null ? prompt.copy() : Activity.message(null, InputHints.ACCEPTING_INPUT);
        boolean hasCard = message.getAttachments().stream().anyMatch(CardFactory::isOAuthCard);
        if (!hasCard) {
            Activity activity = context.getActivity();
            SignInResource resource = this.userTokenClient.getSignInResource(this.settings.connectionName(),
                    activity.getConversationReference(), activity.getRelatesTo());
            String link = this.settings.showSignInLink() || "msteams".equals(activity.getChannelId())
                    ? resource.signInLink() : null;
            Attachment card = CardFactory.oauthCard(this.settings.connectionName(), this.settings.title(),
                    this.settings.text(), link, resource.tokenExchangeResource(), resource.tokenPostResource());
            message.getAttachments().add(card);
        }
        if (context.getLoginTimeoutMs() == null) {
            context.setLoginTimeoutMs(this.settings.effectiveTimeoutMs());
        }
        if (message.getInputHint() == null) {
            message.setInputHint(InputHints.ACCEPTING_INPUT);
        }
        context.sendActivity(message);
    }

    private PromptRecognizerResult<TokenResponse> recognizeTokenResponseEvent(TurnContext context) {
        Object value = context.getActivity().getValue();
        if (value == null) {
            return PromptRecognizerResult.failure();
        }
        return PromptRecognizerResult.success(StateValues.convert(value, TokenResponse.class));
    }

    private PromptRecognizerResult<TokenResponse> recognizeVerifyState(TurnContext context) {
        Map<String, Object> value = context.getActivity().getValueAsMap();
        String magicCode = value == null || value.get("state") == null ? null : value.get("state").toString();
        try {
            TokenResponse token = getUserToken(context, magicCode);
            if (token != null && token.hasToken()) {
                context.sendActivity(Activity.invokeResponse(200, null));
                return PromptRecognizerResult.success(token);
            }
            context.sendActivity(Activity.invokeResponse(404, null));
        } catch (RuntimeException e) {
            log.warn("verifyState failed for connection {}: {}", LogSanitizer.sanitize(this.settings.connectionName()), e.getMessage());
            context.sendActivity(Activity.invokeResponse(500, null));
        }
        return PromptRecognizerResult.failure();
    }

    private PromptRecognizerResult<TokenResponse> recognizeTokenExchange(TurnContext context) {
        Activity activity = context.getActivity();
        Map<String, Object> value = activity.getValueAsMap();
        String connectionName = this.settings.connectionName();
        if (value == null || !value.containsKey("token")) {
            context.sendActivity(Activity.invokeResponse(400, new TokenExchangeInvokeResponse(
                    value == null || value.get("id") == null ? null : value.get("id").toString(), connectionName,
                    "The bot received an InvokeActivity that is missing a TokenExchangeInvokeRequest value."
                            + " This is required to be sent with the InvokeActivity.")));
            return PromptRecognizerResult.failure();
        }
        TokenExchangeInvokeRequest request = StateValues.convert(value, TokenExchangeInvokeRequest.class);
        if (!connectionName.equals(request.connectionName())) {
            context.sendActivity(Activity.invokeResponse(400, new TokenExchangeInvokeResponse(request.id(), connectionName,
                    "The bot received an InvokeActivity with a TokenExchangeInvokeRequest containing a ConnectionName"
                            + " that does not match the ConnectionName expected by the bot's active OAuthPrompt."
                            + " Ensure these names match when sending the InvokeActivityInvalid ConnectionName in the"
                            + " TokenExchangeInvokeRequest")));
            return PromptRecognizerResult.failure();
        }

        TokenResponse exchanged;
        try {
            exchanged = this.userTokenClient.exchangeToken(activity.getFrom().id(), connectionName, activity.getChannelId(),
                    new TokenExchangeRequest(null, request.token(), request.id()));
        } catch (RuntimeException e) {
            log.warn("Token exchange failed for connection {}: {}", LogSanitizer.sanitize(connectionName), e.getMessage());
            exchanged = null;
        }
        if (exchanged == null || !exchanged.hasToken()) {
            context.sendActivity(Activity.invokeResponse(412,
                    new TokenExchangeInvokeResponse(request.id(), connectionName, EXCHANGE_FAILED_DETAIL)));
            return PromptRecognizerResult.failure();
        }
        context.sendActivity(Activity.invokeResponse(200,
                new TokenExchangeInvokeResponse(request.id(), connectionName, null)));
        return PromptRecognizerResult.success(new TokenResponse(exchanged.channelId(), exchanged.connectionName(),
                exchanged.token(), null));
    }

    private PromptRecognizerResult<TokenResponse> recognizeMagicCode(TurnContext context) {
        String text = context.getActivity().getText();
        if (text == null) {
            return PromptRecognizerResult.failure();
        }
        Matcher matcher = MAGIC_CODE.matcher(text);
        if (!matcher.find()) {
            return PromptRecognizerResult.failure();
        }
        TokenResponse token = getUserToken(context, matcher.group(1));
        return token != null && token.hasToken() ? PromptRecognizerResult.success(token) : PromptRecognizerResult.failure();
    }
}
