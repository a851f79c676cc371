package com.jreinhal.colloquy.oauth;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.TestActivities;
import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.CardFactory;
import com.jreinhal.colloquy.activity.ChannelAccount;
import com.jreinhal.colloquy.dialogs.DialogConfigurationException;
import com.jreinhal.colloquy.storage.MemoryStorage;
import com.jreinhal.colloquy.turn.TurnContext;
import java.time.Clock;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OAuthFlowTest {
    private static final long NOW = 1_700_000_000_000L;

    private UserTokenClient tokenClient;
    private Clock clock;
    private OAuthFlow flow;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        this.tokenClient = mock(UserTokenClient.class);
        this.clock = mock(Clock.class);
        when(this.clock.millis()).thenReturn(NOW);
        when(this.tokenClient.getUserToken(anyString(), anyString(), anyString(), any())).thenReturn(TokenResponse.empty());
        when(this.tokenClient.getTokenOrSignInResource(anyString(), anyString(), anyString(), any(), any(), any()))
                .thenReturn(new TokenOrSignInResourceResponse(null, new SignInResource("https://login.example.com", null, null)));
        this.flow = new OAuthFlow(new MemoryStorage(mapper), this.tokenClient, mapper, this.clock, "graph", null, null);
    }

    private static TurnContext turn(Activity activity) {
        return TestActivities.turn(activity);
    }

    private TurnContext started() {
        TurnContext context = turn(TestActivities.message("login"));
        assertNull(this.flow.beginFlow(context));
        return context;
    }

    @Test
    void flowStateKeyIsScopedToChannelConversationAndUser() {
        assertEquals("oauth/test/conv-1/user-1/flowState", OAuthFlow.flowStateKey(turn(TestActivities.message("x"))));

        Activity noConversation = TestActivities.message("x");
        noConversation.setConversation(null);
        assertThrows(IllegalStateException.class, () -> OAuthFlow.flowStateKey(turn(noConversation)));
    }

    @Test
    void beginSendsCardAndStartsTheFlow() {
        TurnContext context = started();

        Activity card = context.getSentActivities().get(0);
        assertTrue(CardFactory.isOAuthCard(card.getAttachments().get(0)));
        CardFactory.OAuthCardContent content = (CardFactory.OAuthCardContent) card.getAttachments().get(0).content();
        assertEquals("login", content.text());
        assertEquals("Sign in", content.buttons().get(0).title());
        FlowState state = this.flow.getFlowState(context);
        assertTrue(state.isFlowStarted());
        assertEquals(NOW + OAuthFlow.FLOW_TIMEOUT_MS, state.getFlowExpires());
    }

    @Test
    void beginReturnsAnExistingToken() {
        when(this.tokenClient.getTokenOrSignInResource(anyString(), anyString(), anyString(), any(), any(), any()))
                .thenReturn(new TokenOrSignInResourceResponse(TokenResponse.of("cached"), null));
        TurnContext context = turn(TestActivities.message("login"));

        TokenResponse token = this.flow.beginFlow(context);

        assertEquals("cached", token.token());
        assertTrue(context.getSentActivities().isEmpty());
        assertFalse(this.flow.getFlowState(context).isFlowStarted());
    }

    @Test
    void beginRequiresAConnectionName() {
        OAuthFlow unnamed = new OAuthFlow(new MemoryStorage(new ObjectMapper()), this.tokenClient, new ObjectMapper(),
                this.clock, " ", null, null);

        assertThrows(DialogConfigurationException.class, () -> unnamed.beginFlow(turn(TestActivities.message("x"))));
    }

    @Test
    void messageTextIsUsedAsTheMagicCode() {
        started();
        when(this.tokenClient.getUserToken("graph", TestActivities.CHANNEL, TestActivities.USER, "123456"))
                .thenReturn(TokenResponse.of("token"));

        assertEquals("token", this.flow.continueFlow(turn(TestActivities.message("123456"))).token());
    }

    @Test
    void verifyStateUsesTheStateValue() {
        started();
        when(this.tokenClient.getUserToken("graph", TestActivities.CHANNEL, TestActivities.USER, "987654"))
                .thenReturn(TokenResponse.of("verified"));

        TokenResponse token = this.flow.continueFlow(turn(TestActivities.invoke(
                SignInActivityKind.VERIFY_STATE_OPERATION_NAME, Map.of("state", "987654"))));

        assertEquals("verified", token.token());
    }

    @Test
    void expiredFlowTellsTheUserAndStops() {
        started();
        when(this.clock.millis()).thenReturn(NOW + OAuthFlow.FLOW_TIMEOUT_MS + 1);
        TurnContext context = turn(TestActivities.message("123456"));

        TokenResponse token = this.flow.continueFlow(context);

        assertFalse(token.hasToken());
        assertEquals(OAuthFlow.EXPIRED_MESSAGE, context.getSentActivities().get(0).getText());
        assertFalse(this.flow.getFlowState(context).isFlowStarted());
        verify(this.tokenClient, never()).getUserToken(anyString(), anyString(), anyString(), any(String.class));
    }

    @Test
    void repeatedTokenExchangeIsIgnored() {
        started();
        when(this.tokenClient.exchangeToken(anyString(), anyString(), anyString(), any())).thenReturn(TokenResponse.empty());
        Map<String, Object> request = Map.of("id", "exchange-1", "token", "sso");

        TokenResponse first = this.flow.continueFlow(turn(TestActivities.invoke(SignInActivityKind.TOKEN_EXCHANGE_OPERATION_NAME, request)));
        TokenResponse second = this.flow.continueFlow(turn(TestActivities.invoke(SignInActivityKind.TOKEN_EXCHANGE_OPERATION_NAME, request)));

        assertFalse(first.hasToken());
        assertFalse(second.hasToken());
        verify(this.tokenClient, times(1)).exchangeToken(anyString(), anyString(), anyString(), any());
        assertEquals("exchange-1", this.flow.getFlowState(turn(TestActivities.message("x"))).getTokenExchangeId());
    }

    @Test
    void successfulTokenExchangeEndsTheFlow() {
        started();
        when(this.tokenClient.exchangeToken(TestActivities.USER, "graph", TestActivities.CHANNEL,
                new TokenExchangeRequest(null, "sso", "exchange-2"))).thenReturn(TokenResponse.of("exchanged"));
        TurnContext context = turn(TestActivities.invoke(SignInActivityKind.TOKEN_EXCHANGE_OPERATION_NAME,
                Map.of("id", "exchange-2", "token", "sso")));

        assertEquals("exchanged", this.flow.continueFlow(context).token());
        assertFalse(this.flow.getFlowState(context).isFlowStarted());
    }

    @Test
    void tokenResponseEventIsNotHandledByTheFlow() {
        started();

        TokenResponse token = this.flow.continueFlow(turn(TestActivities.event(
                SignInActivityKind.TOKEN_RESPONSE_EVENT_NAME, Map.of("token", "abc"))));

        assertFalse(token.hasToken());
    }

    @Test
    void signOutClearsTheExpiry() {
        TurnContext context = started();

        this.flow.signOut(context);

        verify(this.tokenClient).signOut(TestActivities.USER, "graph", TestActivities.CHANNEL);
        assertEquals(0, this.flow.getFlowState(context).getFlowExpires());
    }

    @Test
    void userTokenNeedsTheSender() {
        Activity anonymous = TestActivities.message("x");
        anonymous.setFrom(new ChannelAccount(null, null));

        assertThrows(IllegalStateException.class, () -> this.flow.getUserToken(turn(anonymous)));
    }
}
