package com.jreinhal.colloquy.dialogs.prompts;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

import com.jreinhal.colloquy.TestActivities;
import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.ActivityTypes;
import com.jreinhal.colloquy.activity.Attachment;
import com.jreinhal.colloquy.activity.CardFactory;
import com.jreinhal.colloquy.activity.InvokeResponse;
import com.jreinhal.colloquy.dialogs.DialogConfigurationException;
import com.jreinhal.colloquy.dialogs.DialogContext;
import com.jreinhal.colloquy.dialogs.DialogSet;
import com.jreinhal.colloquy.dialogs.DialogState;
import com.jreinhal.colloquy.dialogs.DialogTurnResult;
import com.jreinhal.colloquy.dialogs.DialogTurnStatus;
import com.jreinhal.colloquy.oauth.SignInActivityKind;
import com.jreinhal.colloquy.oauth.SignInResource;
import com.jreinhal.colloquy.oauth.TokenExchangeInvokeResponse;
import com.jreinhal.colloquy.oauth.TokenExchangeRequest;
import com.jreinhal.colloquy.oauth.TokenResponse;
import com.jreinhal.colloquy.oauth.UserTokenClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OAuthPromptTest {
    private static final String CONNECTION = "graph";
    private static final Clock START = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private UserTokenClient tokenClient;
    private DialogSet set;
    private DialogState state;

    @BeforeEach
    void setUp() {
        this.tokenClient = mock(UserTokenClient.class);
        when(this.tokenClient.getUserToken(anyString(), anyString(), anyString(), any())).thenReturn(TokenResponse.empty());
        when(this.tokenClient.getSignInResource(anyString(), any(), any()))
                .thenReturn(new SignInResource("https://login.example.com/start", null, null));
        this.state = new DialogState();
        this.set = promptSet(new OAuthPromptSettings(CONNECTION, "Sign in", "Please sign in"), START);
    }

    private DialogSet promptSet(OAuthPromptSettings settings, Clock clock) {
        return new DialogSet().add(new OAuthPrompt("login", settings, this.tokenClient, clock));
    }

    private DialogContext turn(Activity activity) {
        return new DialogContext(this.set, TestActivities.turn(activity), this.state);
    }

    private DialogContext begin() {
        DialogContext dc = turn(TestActivities.message("login"));
        assertEquals(DialogTurnStatus.WAITING, dc.beginDialog("login").status());
        return dc;
    }

    private static InvokeResponse invokeResponse(DialogContext dc) {
        List<Activity> sent = dc.getContext().getSentActivities();
        assertEquals(1, sent.size());
        assertTrue(sent.get(0).isType(ActivityTypes.INVOKE_RESPONSE));
        return (InvokeResponse) sent.get(0).getValue();
    }

    @Test
    void beginSendsASingleSignInCard() {
        DialogContext dc = begin();

        List<Activity> sent = dc.getContext().getSentActivities();
        assertEquals(1, sent.size());
        Attachment card = sent.get(0).getAttachments().get(0);
        assertTrue(CardFactory.isOAuthCard(card));
        CardFactory.OAuthCardContent content = (CardFactory.OAuthCardContent) card.content();
        assertEquals(CONNECTION, content.connectionName());
        assertEquals("Please sign in", content.text());
        assertEquals("https://login.example.com/start", content.buttons().get(0).value());
        assertEquals(OAuthPrompt.DEFAULT_TIMEOUT_MS, dc.getContext().getLoginTimeoutMs());
        assertEquals(START.millis() + OAuthPrompt.DEFAULT_TIMEOUT_MS,
                this.state.getDialogStack().get(0).getState().get("expires"));
    }

    @Test
    void signInLinkIsOmittedUnlessRequested() {
        this.set = promptSet(new OAuthPromptSettings(CONNECTION, "Sign in", "text", null, false, false), START);

        CardFactory.OAuthCardContent content = (CardFactory.OAuthCardContent)
                begin().getContext().getSentActivities().get(0).getAttachments().get(0).content();

        assertNull(content.buttons().get(0).value());
    }

    @Test
    void existingTokenEndsImmediately() {
        when(this.tokenClient.getUserToken(CONNECTION, TestActivities.CHANNEL, TestActivities.USER, null))
                .thenReturn(TokenResponse.of("existing"));

        DialogTurnResult result = turn(TestActivities.message("login")).beginDialog("login");

        assertEquals(DialogTurnStatus.COMPLETE, result.status());
        assertEquals("existing", ((TokenResponse) result.result()).token());
        verify(this.tokenClient, never()).getSignInResource(anyString(), any(), any());
    }

    @Test
    void magicCodeInMessageIsRedeemed() {
        begin();
        when(this.tokenClient.getUserToken(CONNECTION, TestActivities.CHANNEL, TestActivities.USER, "123456"))
                .thenReturn(TokenResponse.of("from-code"));

        DialogTurnResult result = turn(TestActivities.message("Here is your code 123456, thanks")).continueDialog();

        assertEquals(DialogTurnStatus.COMPLETE, result.status());
        assertEquals("from-code", ((TokenResponse) result.result()).token());
    }

    @Test
    void longerDigitRunIsNotAMagicCode() {
        begin();
        when(this.tokenClient.getUserToken(CONNECTION, TestActivities.CHANNEL, TestActivities.USER, "123456"))
                .thenReturn(TokenResponse.of("from-code"));

        DialogTurnResult result = turn(TestActivities.message("my phone is 1234567890")).continueDialog();

        assertEquals(DialogTurnStatus.WAITING, result.status());
        verify(this.tokenClient, never()).getUserToken(anyString(), anyString(), anyString(), eq("123456"));
    }

    @Test
    void cardIsNotAddedToTheStoredPrompt() {
        PromptOptions options = PromptOptions.text("Sign in please", "Still waiting for you to sign in.");
        DialogContext dc = turn(TestActivities.message("login"));
        dc.beginDialog("login", options);

        assertTrue(CardFactory.isOAuthCard(dc.getContext().getSentActivities().get(0).getAttachments().get(0)));
        assertTrue(options.getPrompt().getAttachments().isEmpty());
        assertNull(options.getPrompt().getReplyToId());
    }

    @Test
    void messageWithoutCodeSendsRetryPrompt() {
        DialogContext dc = turn(TestActivities.message("login"));
        dc.beginDialog("login", PromptOptions.text("Sign in please", "Still waiting for you to sign in."));

        DialogContext retry = turn(TestActivities.message("what?"));

        assertEquals(DialogTurnStatus.WAITING, retry.continueDialog().status());
        assertEquals("Still waiting for you to sign in.", retry.getContext().getSentActivities().get(0).getText());
        verify(this.tokenClient, never()).getUserToken(anyString(), anyString(), anyString(), eq("what?"));
    }

    @Test
    void invalidMessageEndsThePromptWhenConfigured() {
        this.set = promptSet(new OAuthPromptSettings(CONNECTION, "Sign in", "text", null, true, true), START);
        begin();

        DialogTurnResult result = turn(TestActivities.message("no code here")).continueDialog();

        assertEquals(DialogTurnStatus.COMPLETE, result.status());
        assertNull(result.result());
    }

    @Test
    void tokenResponseEventCompletesThePrompt() {
        begin();

        DialogTurnResult result = turn(TestActivities.event(SignInActivityKind.TOKEN_RESPONSE_EVENT_NAME,
                Map.of("connectionName", CONNECTION, "token", "evt-token"))).continueDialog();

        assertEquals("evt-token", ((TokenResponse) result.result()).token());
    }

    @Test
    void verifyStateAnswers200WithAToken() {
        begin();
        when(this.tokenClient.getUserToken(CONNECTION, TestActivities.CHANNEL, TestActivities.USER, "654321"))
                .thenReturn(TokenResponse.of("verified"));

        DialogContext dc = turn(TestActivities.invoke(SignInActivityKind.VERIFY_STATE_OPERATION_NAME, Map.of("state", "654321")));
        DialogTurnResult result = dc.continueDialog();

        assertEquals(200, invokeResponse(dc).status());
        assertEquals("verified", ((TokenResponse) result.result()).token());
    }

    @Test
    void verifyStateAnswers404WithoutAToken() {
        begin();

        DialogContext dc = turn(TestActivities.invoke(SignInActivityKind.VERIFY_STATE_OPERATION_NAME, Map.of("state", "000000")));

        assertEquals(DialogTurnStatus.WAITING, dc.continueDialog().status());
        assertEquals(404, invokeResponse(dc).status());
    }

    @Test
    void verifyStateAnswers500WhenTheServiceFails() {
        begin();
        when(this.tokenClient.getUserToken(CONNECTION, TestActivities.CHANNEL, TestActivities.USER, "111111"))
                .thenThrow(new IllegalStateException("down"));

        DialogContext dc = turn(TestActivities.invoke(SignInActivityKind.VERIFY_STATE_OPERATION_NAME, Map.of("state", "111111")));

        assertEquals(DialogTurnStatus.WAITING, dc.continueDialog().status());
        assertEquals(500, invokeResponse(dc).status());
    }

    @Test
    void tokenExchangeWithoutTokenIsABadRequest() {
        begin();

        DialogContext dc = turn(TestActivities.invoke(SignInActivityKind.TOKEN_EXCHANGE_OPERATION_NAME, Map.of("id", "x1")));
        dc.continueDialog();

        InvokeResponse response = invokeResponse(dc);
        assertEquals(400, response.status());
        assertEquals("x1", ((TokenExchangeInvokeResponse) response.body()).id());
    }

    @Test
    void tokenExchangeForAnotherConnectionIsABadRequest() {
        begin();

        DialogContext dc = turn(TestActivities.invoke(SignInActivityKind.TOKEN_EXCHANGE_OPERATION_NAME,
                Map.of("id", "x2", "connectionName", "other", "token", "sso")));
        dc.continueDialog();

        assertEquals(400, invokeResponse(dc).status());
        verify(this.tokenClient, never()).exchangeToken(anyString(), anyString(), anyString(), any());
    }

    @Test
    void failedTokenExchangeIsAPreconditionFailure() {
        begin();
        when(this.tokenClient.exchangeToken(anyString(), anyString(), anyString(), any())).thenReturn(TokenResponse.empty());

        DialogContext dc = turn(TestActivities.invoke(SignInActivityKind.TOKEN_EXCHANGE_OPERATION_NAME,
                Map.of("id", "x3", "connectionName", CONNECTION, "token", "sso")));

        assertEquals(DialogTurnStatus.WAITING, dc.continueDialog().status());
        InvokeResponse response = invokeResponse(dc);
        assertEquals(412, response.status());
        assertEquals(OAuthPrompt.EXCHANGE_FAILED_DETAIL, ((TokenExchangeInvokeResponse) response.body()).failureDetail());
    }

    @Test
    void successfulTokenExchangeCompletesThePrompt() {
        begin();
        when(this.tokenClient.exchangeToken(TestActivities.USER, CONNECTION, TestActivities.CHANNEL,
                new TokenExchangeRequest(null, "sso", "x4"))).thenReturn(new TokenResponse("test", CONNECTION, "exchanged", "later"));

        DialogContext dc = turn(TestActivities.invoke(SignInActivityKind.TOKEN_EXCHANGE_OPERATION_NAME,
                Map.of("id", "x4", "connectionName", CONNECTION, "token", "sso")));
        DialogTurnResult result = dc.continueDialog();

        assertEquals(200, invokeResponse(dc).status());
        TokenResponse token = (TokenResponse) result.result();
        assertEquals("exchanged", token.token());
        assertNull(token.expiration());
    }

    @Test
    void expiredPromptEndsWithoutResult() {
        begin();
        this.set = promptSet(new OAuthPromptSettings(CONNECTION, "Sign in", "text"),
                Clock.offset(START, Duration.ofMillis(OAuthPrompt.DEFAULT_TIMEOUT_MS + 1)));

        DialogTurnResult result = turn(TestActivities.message("123456")).continueDialog();

        assertEquals(DialogTurnStatus.COMPLETE, result.status());
        assertNull(result.result());
        verify(this.tokenClient, never()).getUserToken(anyString(), anyString(), anyString(), eq("123456"));
    }

    @Test
    void customTimeoutIsHonoured() {
        this.set = promptSet(new OAuthPromptSettings(CONNECTION, "Sign in", "text", 1000L, false, true), START);
        begin();
        this.set = promptSet(new OAuthPromptSettings(CONNECTION, "Sign in", "text", 1000L, false, true),
                Clock.offset(START, Duration.ofMillis(999)));

        assertEquals(DialogTurnStatus.WAITING, turn(TestActivities.message("hello")).continueDialog().status());
    }

    @Test
    void validatorCountsAttempts() {
        this.set = new DialogSet().add(new OAuthPrompt("login", new OAuthPromptSettings(CONNECTION, "Sign in", "text"),
                this.tokenClient, START, ctx -> ctx.attemptCount() >= 2));
        begin();

        assertEquals(DialogTurnStatus.WAITING, turn(TestActivities.message("one")).continueDialog().status());
        DialogTurnResult second = turn(TestActivities.message("two")).continueDialog();

        assertEquals(DialogTurnStatus.COMPLETE, second.status());
        assertNull(second.result());
    }

    @Test
    void connectionNameIsRequired() {
        assertThrows(DialogConfigurationException.class, () ->
                new OAuthPrompt("login", new OAuthPromptSettings(" ", "t", "x"), this.tokenClient, START));
    }

    @Test
    void signOutUsesTheConnection() {
        DialogContext dc = turn(TestActivities.message("logout"));
        OAuthPrompt prompt = (OAuthPrompt) this.set.find("login");

        prompt.signOutUser(dc.getContext());

        verify(this.tokenClient).signOut(TestActivities.USER, CONNECTION, TestActivities.CHANNEL);
        verify(this.tokenClient, never()).getUserToken(anyString(), anyString(), anyString(), isNull());
    }
}
