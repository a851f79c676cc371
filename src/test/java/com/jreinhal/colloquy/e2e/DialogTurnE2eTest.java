package com.jreinhal.colloquy.e2e;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jreinhal.colloquy.oauth.SignInResource;
import com.jreinhal.colloquy.oauth.TokenResponse;
import com.jreinhal.colloquy.oauth.UserTokenClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest(properties = {
        "colloquy.storage.type=memory",
        "colloquy.oauth.connection-name=graph-connection"
})
@AutoConfigureMockMvc
class DialogTurnE2eTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean(answer = Answers.RETURNS_DEEP_STUBS)
    private MongoTemplate mongoTemplate;

    @MockBean
    private UserTokenClient userTokenClient;

    @BeforeEach
    void setup() {
        when(this.userTokenClient.getUserToken(anyString(), anyString(), anyString(), any()))
                .thenReturn(TokenResponse.empty());
        when(this.userTokenClient.getSignInResource(anyString(), any(), any()))
                .thenReturn(new SignInResource("https://login.example.com/start", null, null));
    }

    private ResultActions say(String conversation, String user, String text) throws Exception {
        String body = """
                {"type":"message","channelId":"e2e","text":"%s",
                 "conversation":{"id":"%s"},"from":{"id":"%s"},"recipient":{"id":"colloquy"}}
                """.formatted(text, conversation, user);
        return this.mockMvc.perform(post("/api/turns").contentType(MediaType.APPLICATION_JSON).content(body));
    }

    @Test
    void profileConversationRunsOverHttp() throws Exception {
        say("profile", "u-profile", "hello")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].text").value("Please enter your name."))
                .andExpect(jsonPath("$[0].inputHint").value("expectingInput"))
                .andExpect(jsonPath("$[0].recipient.id").value("u-profile"));
        say("profile", "u-profile", "Grace")
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].text").value("Thanks Grace."));
        say("profile", "u-profile", "no")
                .andExpect(jsonPath("$[0].text").value("I have your name as Grace and no age."))
                .andExpect(jsonPath("$[1].text").value("Type anything to start again."));
    }

    @Test
    void loginSendsCardThenRedeemsCode() throws Exception {
        when(this.userTokenClient.getUserToken(eq("graph-connection"), eq("e2e"), eq("u-login"), isNull()))
                .thenReturn(TokenResponse.empty());
        when(this.userTokenClient.getUserToken("graph-connection", "e2e", "u-login", "654321"))
                .thenReturn(TokenResponse.of("e2e-token"));

        say("login", "u-login", "login")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].attachments[0].contentType").value("application/vnd.microsoft.card.oauth"))
                .andExpect(jsonPath("$[0].attachments[0].content.connectionName").value("graph-connection"));
        say("login", "u-login", "654321")
                .andExpect(jsonPath("$[0].text").value("You are now logged in."));
        say("login", "u-login", "yes")
                .andExpect(jsonPath("$[0].text").value("Here is your token e2e-token"));
    }

    @Test
    void invalidActivityIsRejected() throws Exception {
        this.mockMvc.perform(post("/api/turns").contentType(MediaType.APPLICATION_JSON).content("{\"channelId\":\"e2e\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Activity type is required"));
    }
}
