package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.channel.SlackChannel;
import com.autonomous.orchestrator.router.CommandRouter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/slack")
public class SlackController {

    @Autowired
    private SlackChannel slackChannel;

    @Autowired
    private CommandRouter router;

    @PostMapping("/events")
    public ResponseEntity<?> handleSlackEvent(@RequestBody Map<String, Object> payload) {
        if (payload.containsKey("challenge")) {
            return ResponseEntity.ok(Map.of("challenge", payload.get("challenge")));
        }

        // acknowledge at once, Slack retries anything slower than three seconds
        slackChannel.toChannelEvent(payload).ifPresent(event ->
            router.deliver(event.getSource(), event.getChatId(), event.getUserId(), event.getText()));
        return ResponseEntity.ok().build();
    }

    @PostMapping("/slash-commands")
    public ResponseEntity<?> handleSlashCommand(@RequestParam Map<String, String> params) {
        String command = params.get("command");
        String text = params.getOrDefault("text", "");
        String userId = params.get("user_id");
        String channelId = params.get("channel_id");

        String response = router.handleCommand(SlackChannel.SOURCE, channelId, userId,
            (command + " " + text).trim());

        return ResponseEntity.ok(Map.of(
            "response_type", "in_channel",
            "text", response
        ));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
