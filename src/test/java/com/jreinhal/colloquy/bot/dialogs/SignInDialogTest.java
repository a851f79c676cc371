package com.jreinhal.colloquy.bot.dialogs;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.TestActivities;
import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.dialogs.DialogRunner;
import com.jreinhal.colloquy.dialogs.DialogState;
import com.jreinhal.colloquy.dialogs.prompts.OAuthPrompt;
import com.jreinhal.colloquy.dialogs.prompts.OAuthPromptSettings;
import com.jreinhal.colloquy.oauth.SignInResource;
import com.jreinhal.colloquy.oauth.TokenResponse;
import com.jreinhal.colloquy.oauth.UserTokenClient;
import com.jreinhal.colloquy.state.ConversationState;
import com.jreinhal.colloquy.state.StatePropertyAccessor;
import com.jreinhal.colloquy.state.UserState;
import com.jreinhal.colloquy.storage.MemoryStorage;
import com.jreinhal.colloquy.turn.TurnContext;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SignInDialogTest {

    private UserTokenClient tokenClient;
    private ConversationState conversationState;
    private StatePropertyAccessor<DialogState> dialogState;
    private MainDialog mainDialog;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        MemoryStorage storage = new MemoryStorage(mapper);
        this.tokenClient = mock(UserTokenClient.class);
        when(this.tokenClient.getUserToken(anyString(), anyString(), anyString(), any())).thenReturn(TokenResponse.empty());
        when(this.tokenClient.getSignInResource(anyString(), any(), any()))
                .thenReturn(new SignInResource("https://login.example.com", null, null));
        this.conversationState = new ConversationState(storage, mapper);
        this.dialogState = this.conversationState.createProperty("dialogState", DialogState.class);
        SignInDialog signIn = new SignInDialog(new OAuthPromptSettings("graph", "Sign in", "Please sign in"),
                this.tokenClient, Clock.systemUTC());
        this.mainDialog = new MainDialog(new UserProfileDialog(new UserState(storage, mapper)), signIn);
    }

    private List<Activity> say(String text) {
        TurnContext context = TestActivities.turn(TestActivities.message(text));
        DialogRunner.run(this.mainDialog, context, this.dialogState);
        this.conversationState.saveChanges(context);
        return context.getSentActivities();
    }

    @Test
    void loginShowsTheCardThenTheToken() {
        List<Activity> card = say("login");
        assertEquals(1, card.size());
        assertFalse(card.get(0).getAttachments().isEmpty());

        when(this.tokenClient.getUserToken("graph", TestActivities.CHANNEL, TestActivities.USER, "482913"))
                .thenReturn(TokenResponse.of("secret-token"));
        List<String> loggedIn = say("my code is 482913").stream().map(Activity::getText).toList();
        assertEquals(List.of("You are now logged in.", "Would you like to view your token? (1) Yes or (2) No"), loggedIn);

        List<String> shown = say("yes").stream().map(Activity::getText).toList();
        assertEquals(List.of("Here is your token secret-token", "Type anything to start again."), shown);
    }

    @Test
    void expiredPromptReportsFailure() {
        Clock clock = mock(Clock.class);
        when(clock.millis()).thenReturn(1_000L, 1_000L + OAuthPrompt.DEFAULT_TIMEOUT_MS + 1);
        ObjectMapper mapper = new ObjectMapper();
        SignInDialog signIn = new SignInDialog(new OAuthPromptSettings("graph", "Sign in", "Please sign in"),
                this.tokenClient, clock);
        this.mainDialog = new MainDialog(new UserProfileDialog(new UserState(new MemoryStorage(mapper), mapper)), signIn);
        say("login");

        List<String> replies = say("my code is 482913").stream().map(Activity::getText).toList();

        assertEquals(List.of("Login was not successful please try again.", "Type anything to start again."), replies);
        verify(this.tokenClient, never()).getUserToken("graph", TestActivities.CHANNEL, TestActivities.USER, "482913");
    }

    @Test
    void existingTokenSkipsTheCard() {
        when(this.tokenClient.getUserToken("graph", TestActivities.CHANNEL, TestActivities.USER, null))
                .thenReturn(TokenResponse.of("cached"));

        List<String> replies = say("login").stream().map(Activity::getText).toList();

        assertEquals(List.of("You are now logged in.", "Would you like to view your token? (1) Yes or (2) No"), replies);
        verify(this.tokenClient, never()).getSignInResource(anyString(), any(), any());
    }
}
