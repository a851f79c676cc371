package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Value of a {@code signin/tokenExchange} invoke.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenExchangeInvokeRequest(String id, String connectionName, String token) {
}
