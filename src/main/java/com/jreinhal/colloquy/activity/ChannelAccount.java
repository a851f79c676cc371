package com.jreinhal.colloquy.activity;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelAccount(String id, String name, String role) {

    public ChannelAccount(String id, String name) {
        this(id, name, null);
    }
}
