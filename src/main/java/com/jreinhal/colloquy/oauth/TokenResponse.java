package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(String channelId, String connectionName, String token, String expiration) {

    private static final TokenResponse EMPTY = new TokenResponse(null, null, null, null);

    /**
     * "No token yet". Not an error.
     */
    public static TokenResponse empty() {
        return EMPTY;
    }

    public static TokenResponse of(String token) {
        return new TokenResponse(null, null, token, null);
    }

    @JsonIgnore
    public boolean hasToken() {
        return this.token != null && !this.token.isBlank();
    }
}
