package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.channel.ChannelEvent;
import com.autonomous.orchestrator.channel.SlackChannel;
import com.autonomous.orchestrator.router.CommandRouter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SlackController.class)
class SlackControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SlackChannel slackChannel;

    @MockBean
    private CommandRouter router;

    @Test
    void shouldAnswerUrlVerification() throws Exception {
        mockMvc.perform(post("/slack/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"url_verification\",\"challenge\":\"abc123\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.challenge").value("abc123"));

        verifyNoInteractions(router);
    }

    @Test
    void shouldDeliverMessageEvents() throws Exception {
        when(slackChannel.toChannelEvent(anyMap()))
            .thenReturn(Optional.of(new ChannelEvent("slack", "C123", "U456", "what's on my list?")));

        mockMvc.perform(post("/slack/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"event_callback\",\"event\":{\"type\":\"message\",\"text\":\"what's on my list?\","
                    + "\"channel\":\"C123\",\"user\":\"U456\",\"ts\":\"1.0\"}}"))
            .andExpect(status().isOk());

        verify(router).deliver("slack", "C123", "U456", "what's on my list?");
    }

    @Test
    void ignoredEventsShouldStillBeAcknowledged() throws Exception {
        when(slackChannel.toChannelEvent(anyMap())).thenReturn(Optional.empty());

        mockMvc.perform(post("/slack/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"event_callback\",\"event\":{\"type\":\"message\",\"bot_id\":\"B1\"}}"))
            .andExpect(status().isOk());

        verifyNoInteractions(router);
    }

    @Test
    void shouldHandleSlashCommand() throws Exception {
        when(router.handleCommand("slack", "C123", "U456", "/model gpt-4o")).thenReturn("Model switched to gpt-4o.");

        mockMvc.perform(post("/slack/slash-commands")
                .param("command", "/model")
                .param("text", "gpt-4o")
                .param("user_id", "U456")
                .param("channel_id", "C123"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.response_type").value("in_channel"))
            .andExpect(jsonPath("$.text").value("Model switched to gpt-4o."));
    }

    @Test
    void shouldHandleSlashCommandWithoutText() throws Exception {
        when(router.handleCommand("slack", "C123", "U456", "/status")).thenReturn("State: running");

        mockMvc.perform(post("/slack/slash-commands")
                .param("command", "/status")
                .param("text", "")
                .param("user_id", "U456")
                .param("channel_id", "C123"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.text").value("State: running"));
    }

    @Test
    void healthShouldReportHealthy() throws Exception {
        mockMvc.perform(get("/slack/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"));
    }
}
