package com.jreinhal.colloquy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.dialogs.prompts.OAuthPromptSettings;
import com.jreinhal.colloquy.oauth.AuthHandler;
import com.jreinhal.colloquy.oauth.Authorization;
import com.jreinhal.colloquy.oauth.OAuthFlow;
import com.jreinhal.colloquy.oauth.RestUserTokenClient;
import com.jreinhal.colloquy.oauth.UserTokenClient;
import com.jreinhal.colloquy.storage.Storage;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.client.RestTemplate;

@Configuration
public class OAuthConfig {
    private static final Logger log = LoggerFactory.getLogger(OAuthConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate tokenServiceRestTemplate(RestTemplateBuilder builder,
                                                 @Value("${colloquy.oauth.connect-timeout-ms:5000}") long connectTimeoutMs,
                                                 @Value("${colloquy.oauth.read-timeout-ms:15000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    @Bean
    public UserTokenClient userTokenClient(RestTemplate tokenServiceRestTemplate, ObjectMapper objectMapper,
                                           @Value("${colloquy.oauth.token-service-url:https://api.botframework.com}") String baseUrl,
                                           @Value("${colloquy.oauth.app-id:}") String appId,
                                           @Value("${colloquy.oauth.app-token:}") String appToken) {
        if (appToken.isBlank()) {
            log.warn("colloquy.oauth.app-token is not set; token service calls will be unauthenticated");
        }
        return new RestUserTokenClient(tokenServiceRestTemplate, objectMapper, baseUrl, appId, appToken);
    }

    @Bean
    public OAuthPromptSettings oauthPromptSettings(@Value("${colloquy.oauth.connection-name:}") String connectionName,
                                                   @Value("${colloquy.oauth.title:Sign In}") String title,
                                                   @Value("${colloquy.oauth.text:Please sign in}") String text,
                                                   @Value("${colloquy.oauth.timeout-ms:900000}") long timeoutMs,
                                                   @Value("${colloquy.oauth.end-on-invalid-message:false}") boolean endOnInvalidMessage) {
        return new OAuthPromptSettings(connectionName, title, text, timeoutMs, endOnInvalidMessage, true);
    }

    /**
     * Handlers are listed in {@code colloquy.auth.handlers}; each one reads
     * {@code colloquy.auth.<id>.connection-name}, {@code .title} and {@code .text}.
     */
    @Bean
    @ConditionalOnProperty(name = "colloquy.auth.handlers")
    public Authorization authorization(Storage storage, UserTokenClient userTokenClient, ObjectMapper objectMapper,
                                       Clock clock, Environment environment,
                                       @Value("${colloquy.auth.handlers}") String handlerIds) {
        Map<String, AuthHandler> handlers = new LinkedHashMap<>();
        Arrays.stream(handlerIds.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .forEach(id -> {
                    String prefix = "colloquy.auth." + id + ".";
                    String connectionName = environment.getProperty(prefix + "connection-name");
                    String title = environment.getProperty(prefix + "title");
                    String text = environment.getProperty(prefix + "text");
                    OAuthFlow flow = new OAuthFlow(storage, userTokenClient, objectMapper, clock, connectionName, title, text);
                    handlers.put(id, new AuthHandler(id, connectionName, title, text, flow));
                });
        return new Authorization(storage, objectMapper, handlers, null);
    }
}
