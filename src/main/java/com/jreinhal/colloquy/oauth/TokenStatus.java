package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenStatus(String channelId, String connectionName, boolean hasToken, String serviceProviderDisplayName) {
}
