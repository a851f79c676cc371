package com.jreinhal.colloquy.controller;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.bot.DialogBot;
import com.jreinhal.colloquy.util.LogSanitizer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Accepts one activity per request and answers with the activities the agent sent while
 * handling it.
 */
@RestController
@RequestMapping("/api/turns")
public class TurnController {
    private static final Logger log = LoggerFactory.getLogger(TurnController.class);

    private final DialogBot dialogBot;

    public TurnController(DialogBot dialogBot) {
        this.dialogBot = dialogBot;
    }

    @PostMapping
    public ResponseEntity<List<Activity>> postTurn(@RequestBody Activity activity) {
        validate(activity);
        log.debug("Turn received: type={}, channel={}, conversation={}, text={}",
                LogSanitizer.sanitize(activity.getType()),
                LogSanitizer.sanitize(activity.getChannelId()),
                LogSanitizer.sanitize(activity.getConversation().id()),
                LogSanitizer.textSummary(activity.getText()));
        return ResponseEntity.ok(this.dialogBot.onTurn(activity));
    }

    private static void validate(Activity activity) {
        if (activity == null) {
            throw new IllegalArgumentException("Activity body is required");
        }
        if (activity.getType() == null || activity.getType().isBlank()) {
            throw new IllegalArgumentException("Activity type is required");
        }
        if (activity.getChannelId() == null || activity.getChannelId().isBlank()) {
            throw new IllegalArgumentException("Activity channelId is required");
        }
        if (activity.getConversation() == null || activity.getConversation().id() == null) {
            throw new IllegalArgumentException("Activity conversation id is required");
        }
        if (activity.getFrom() == null || activity.getFrom().id() == null) {
            throw new IllegalArgumentException("Activity from id is required");
        }
    }
}
