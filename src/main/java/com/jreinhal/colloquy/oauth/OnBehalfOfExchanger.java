package com.jreinhal.colloquy.oauth;

import java.util.List;

/**
 * Swaps a user token issued to this agent for a token to a downstream API.
 */
@FunctionalInterface
public interface OnBehalfOfExchanger {

    String exchange(String handlerId, String userToken, List<String> scopes);
}
