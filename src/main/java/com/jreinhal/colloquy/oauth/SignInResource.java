package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SignInResource(String signInLink, TokenExchangeResource tokenExchangeResource,
                             TokenPostResource tokenPostResource) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenExchangeResource(String id, String uri, String providerId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenPostResource(String sasUrl) {}
}
