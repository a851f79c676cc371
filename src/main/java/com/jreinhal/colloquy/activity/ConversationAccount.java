package com.jreinhal.colloquy.activity;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationAccount(String id, String name, Boolean isGroup, String tenantId) {

    public ConversationAccount(String id) {
        this(id, null, null, null);
    }
}
