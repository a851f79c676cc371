package com.jreinhal.colloquy.activity;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Snapshot of the addressing fields of an activity, enough to continue the
 * conversation later or to bind a sign-in handshake to it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationReference(
        String activityId,
        ChannelAccount user,
        ChannelAccount agent,
        ConversationAccount conversation,
        String channelId,
        String locale,
        String serviceUrl
) {}
