package com.jreinhal.colloquy.oauth;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.activity.ActivityTypes;

/**
 * The inbound shapes that can complete a sign-in, in the order they are checked.
 */
public enum SignInActivityKind {
    TOKEN_RESPONSE_EVENT,
    VERIFY_STATE_INVOKE,
    TOKEN_EXCHANGE_INVOKE,
    MESSAGE,
    UNHANDLED;

    public static final String TOKEN_RESPONSE_EVENT_NAME = "tokens/response";
    public static final String VERIFY_STATE_OPERATION_NAME = "signin/verifyState";
    public static final String TOKEN_EXCHANGE_OPERATION_NAME = "signin/tokenExchange";

    public static SignInActivityKind classify(Activity activity) {
        if (activity.isType(ActivityTypes.EVENT) && TOKEN_RESPONSE_EVENT_NAME.equals(activity.getName())) {
            return TOKEN_RESPONSE_EVENT;
        }
        if (activity.isType(ActivityTypes.INVOKE) && VERIFY_STATE_OPERATION_NAME.equals(activity.getName())) {
            return VERIFY_STATE_INVOKE;
        }
        if (activity.isType(ActivityTypes.INVOKE) && TOKEN_EXCHANGE_OPERATION_NAME.equals(activity.getName())) {
            return TOKEN_EXCHANGE_INVOKE;
        }
        if (activity.isType(ActivityTypes.MESSAGE)) {
            return MESSAGE;
        }
        return UNHANDLED;
    }
}
