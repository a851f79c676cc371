package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.activity.ConversationReference;
import com.jreinhal.colloquy.util.LogSanitizer;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@link UserTokenClient} over HTTP. Every call carries the agent's bearer credential.
 */
public class RestUserTokenClient implements UserTokenClient {
    private static final Logger log = LoggerFactory.getLogger(RestUserTokenClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String appId;
    private final String appToken;

    public RestUserTokenClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, String appId, String appToken) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.appId = appId;
        this.appToken = appToken;
    }

    @Override
    public TokenResponse getUserToken(String connectionName, String channelId, String userId, String code) {
        URI uri = uri("/api/usertoken/GetToken", params(
                "connectionName", connectionName, "channelId", channelId, "userId", userId, "code", code));
        try {
            ResponseEntity<TokenResponse> response = this.restTemplate.exchange(uri, HttpMethod.GET, entity(null), TokenResponse.class);
            return response.getBody() == null ? TokenResponse.empty() : response.getBody();
        } catch (HttpClientErrorException.NotFound e) {
            return TokenResponse.empty();
        } catch (RestClientException e) {
            log.error("GetToken failed for connection {}: {}", LogSanitizer.sanitize(connectionName), e.getMessage());
            return TokenResponse.empty();
        }
    }

    @Override
    public void signOut(String userId, String connectionName, String channelId) {
        URI uri = uri("/api/usertoken/SignOut", params("userId", userId, "connectionName", connectionName, "channelId", channelId));
        try {
            ResponseEntity<Void> response = this.restTemplate.exchange(uri, HttpMethod.DELETE, entity(null), Void.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new TokenServiceException("Failed to sign out (status " + response.getStatusCode().value() + ")");
            }
        } catch (RestClientException e) {
            log.error("SignOut failed for connection {}", LogSanitizer.sanitize(connectionName), e);
            throw new TokenServiceException("Failed to sign out", e);
        }
    }

    @Override
    public SignInResource getSignInResource(String connectionName, ConversationReference conversation, ConversationReference relatesTo) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("connectionName", connectionName);
        state.put("conversation", conversation);
        if (relatesTo != null) {
            state.put("relatesTo", relatesTo);
        }
        state.put("msAppId", this.appId);
        URI uri = uri("/api/botsignin/GetSignInResource", params("state", encodeState(state)));
        try {
            return this.restTemplate.exchange(uri, HttpMethod.GET, entity(null), SignInResource.class).getBody();
        } catch (RestClientException e) {
            log.error("GetSignInResource failed for connection {}", LogSanitizer.sanitize(connectionName), e);
            throw new TokenServiceException("Failed to get sign-in resource", e);
        }
    }

    @Override
    public TokenResponse exchangeToken(String userId, String connectionName, String channelId, TokenExchangeRequest request) {
        URI uri = uri("/api/usertoken/exchange", params("userId", userId, "connectionName", connectionName, "channelId", channelId));
        try {
            ResponseEntity<TokenResponse> response = this.restTemplate.exchange(uri, HttpMethod.POST, entity(request), TokenResponse.class);
            return response.getBody() == null ? TokenResponse.empty() : response.getBody();
        } catch (RestClientException e) {
            log.error("Token exchange failed for connection {}: {}", LogSanitizer.sanitize(connectionName), e.getMessage());
            return TokenResponse.empty();
        }
    }

    @Override
    public TokenOrSignInResourceResponse getTokenOrSignInResource(String userId, String connectionName, String channelId,
                                                                  ConversationReference conversation,
                                                                  ConversationReference relatesTo, String code) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("conversation", conversation);
        if (relatesTo != null) {
            state.put("relatesTo", relatesTo);
        }
        state.put("connectionName", connectionName);
        state.put("msAppId", this.appId);
        URI uri = uri("/api/usertoken/GetTokenOrSignInResource", params(
                "userId", userId, "connectionName", connectionName, "channelId", channelId,
                "state", encodeState(state), "code", code));
        try {
            return this.restTemplate.exchange(uri, HttpMethod.GET, entity(null), TokenOrSignInResourceResponse.class).getBody();
        } catch (RestClientException e) {
            throw new TokenServiceException("Failed to get token or sign-in resource", e);
        }
    }

    @Override
    public List<TokenStatus> getTokenStatus(String userId, String channelId, String include) {
        URI uri = uri("/api/usertoken/GetTokenStatus", params("userId", userId, "channelId", channelId, "include", include));
        try {
            TokenStatus[] statuses = this.restTemplate.exchange(uri, HttpMethod.GET, entity(null), TokenStatus[].class).getBody();
            return statuses == null ? List.of() : Arrays.asList(statuses);
        } catch (RestClientException e) {
            throw new TokenServiceException("Failed to get token status", e);
        }
    }

    String encodeState(Map<String, Object> state) {
        try {
            byte[] json = this.objectMapper.writeValueAsString(state).getBytes(StandardCharsets.UTF_8);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new TokenServiceException("Unable to encode sign-in state", e);
        }
    }

    private HttpEntity<Object> entity(Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, "colloquy");
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        if (this.appToken != null && !this.appToken.isBlank()) {
            headers.setBearerAuth(this.appToken);
        }
        return new HttpEntity<>(body, headers);
    }

    private URI uri(String path, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(this.baseUrl).path(path);
        params.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
        return builder.encode().buildAndExpand(params).toUri();
    }

    private static Map<String, String> params(String... namesAndValues) {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
            if (namesAndValues[i + 1] != null) {
                params.put(namesAndValues[i], namesAndValues[i + 1]);
            }
        }
        return params;
    }
}
