package com.jreinhal.colloquy.activity;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvokeResponse(int status, Object body) {}
