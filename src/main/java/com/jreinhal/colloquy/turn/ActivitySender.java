package com.jreinhal.colloquy.turn;

import com.jreinhal.colloquy.activity.Activity;
import java.util.List;

/**
 * Send operation exposed by the transport for the duration of one turn.
 */
@FunctionalInterface
public interface ActivitySender {

    void send(List<Activity> activities);
}
