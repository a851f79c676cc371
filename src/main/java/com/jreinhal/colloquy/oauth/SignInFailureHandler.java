package com.jreinhal.colloquy.oauth;

import com.jreinhal.colloquy.turn.TurnContext;

@FunctionalInterface
public interface SignInFailureHandler {

    void onFailure(TurnContext context, String handlerId, String message);
}
