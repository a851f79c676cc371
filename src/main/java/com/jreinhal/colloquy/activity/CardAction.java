package com.jreinhal.colloquy.activity;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CardAction(String type, String title, Object value) {
    public static final String SIGN_IN = "signin";
    public static final String OPEN_URL = "openUrl";
    public static final String IM_BACK = "imBack";
}
