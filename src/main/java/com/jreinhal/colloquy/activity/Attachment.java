package com.jreinhal.colloquy.activity;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Attachment(String contentType, Object content, String name) {

    public Attachment(String contentType, Object content) {
        this(contentType, content, null);
    }
}
