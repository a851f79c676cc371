package com.jreinhal.colloquy.config;

import com.jreinhal.colloquy.bot.dialogs.MainDialog;
import com.jreinhal.colloquy.bot.dialogs.SignInDialog;
import com.jreinhal.colloquy.bot.dialogs.UserProfileDialog;
import com.jreinhal.colloquy.dialogs.Dialog;
import com.jreinhal.colloquy.dialogs.prompts.OAuthPromptSettings;
import com.jreinhal.colloquy.oauth.UserTokenClient;
import com.jreinhal.colloquy.state.UserState;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BotConfig {
    private static final Logger log = LoggerFactory.getLogger(BotConfig.class);

    @Bean
    public Dialog rootDialog(UserState userState, OAuthPromptSettings oauthPromptSettings,
                             UserTokenClient userTokenClient, Clock clock) {
        SignInDialog signInDialog = null;
        String connectionName = oauthPromptSettings.connectionName();
        if (connectionName != null && !connectionName.isBlank()) {
            signInDialog = new SignInDialog(oauthPromptSettings, userTokenClient, clock);
        } else {
            log.info("colloquy.oauth.connection-name is not set; the sign-in dialog is disabled");
        }
        return new MainDialog(new UserProfileDialog(userState), signInDialog);
    }
}
