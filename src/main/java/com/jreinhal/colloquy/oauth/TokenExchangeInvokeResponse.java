package com.jreinhal.colloquy.oauth;

public record TokenExchangeInvokeResponse(String id, String connectionName, String failureDetail) {
}
