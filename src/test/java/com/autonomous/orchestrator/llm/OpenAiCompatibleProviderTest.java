package com.autonomous.orchestrator.llm;

import com.autonomous.orchestrator.exception.ProviderException;
import com.autonomous.orchestrator.model.Role;
import com.autonomous.orchestrator.model.ToolCall;
import com.autonomous.orchestrator.model.Turn;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldBuildChatPayloadWithToolHistory() {
        OpenAiCompatibleProvider provider = provider("https://api.openai.com/v1/");
        ToolCall call = new ToolCall("call_1", "read_memory", Map.of());

        ObjectNode payload = provider.buildPayload(CompletionRequest.builder()
            .model("gpt-4o")
            .systemPrompt("You are Turtle.")
            .turns(List.of(
                Turn.builder().role(Role.USER).content("what do you remember?").tokenCount(5).build(),
                Turn.builder().role(Role.ASSISTANT).content("").tokenCount(0).toolCalls(List.of(call)).build(),
                Turn.builder().role(Role.TOOL).content("likes tea").tokenCount(2).toolCallId("call_1").toolName("read_memory").build()))
            .tools(List.of(new ToolDefinition("read_memory", "Read memory", Map.of("type", "object"))))
            .build());

        JsonNode messages = payload.get("messages");
        assertEquals(4, messages.size());
        assertEquals("system", messages.get(0).get("role").asText());
        assertEquals("read_memory", messages.get(2).get("tool_calls").get(0).get("function").get("name").asText());
        assertEquals("call_1", messages.get(3).get("tool_call_id").asText());
        assertEquals("read_memory", payload.get("tools").get(0).get("function").get("name").asText());
    }

    @Test
    void shouldParseTextAndToolCalls() throws Exception {
        OpenAiCompatibleProvider provider = provider("http://localhost/v1");
        JsonNode response = mapper.readTree("{\"choices\":[{\"finish_reason\":\"tool_calls\",\"message\":{\"content\":null,"
            + "\"tool_calls\":[{\"id\":\"c1\",\"type\":\"function\",\"function\":{\"name\":\"execute_shell\","
            + "\"arguments\":\"{\\\"command\\\":\\\"ls\\\"}\"}}]}}],\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":3}}");

        Completion completion = provider.parseResponse(response, "gpt-4o");

        assertEquals("", completion.getText());
        assertTrue(completion.hasToolCalls());
        assertEquals("ls", completion.getToolCalls().get(0).stringArgument("command", null));
        assertEquals(12, completion.getPromptTokens());
        assertEquals(3, completion.getCompletionTokens());
    }

    @Test
    void shouldRejectResponseWithoutChoices() throws Exception {
        OpenAiCompatibleProvider provider = provider("http://localhost/v1");

        assertThrows(ProviderException.class, () -> provider.parseResponse(mapper.readTree("{\"choices\":[]}"), "m"));
    }

    @Test
    void shouldCallEndpointWithBearerToken() throws Exception {
        AtomicReference<String> authorization = new AtomicReference<>();
        String baseUrl = serve(200, "{\"choices\":[{\"message\":{\"content\":\"hi there\"}}],"
            + "\"usage\":{\"prompt_tokens\":4,\"completion_tokens\":2}}", authorization);

        Completion completion = provider(baseUrl).complete(request());

        assertEquals("hi there", completion.getText());
        assertEquals("Bearer test-key", authorization.get());
    }

    @Test
    void rateLimitShouldBeRetryable() throws Exception {
        String baseUrl = serve(429, "{\"error\":\"slow down\"}", new AtomicReference<>());

        ProviderException e = assertThrows(ProviderException.class, () -> provider(baseUrl).complete(request()));
        assertTrue(e.isRetryable());
    }

    @Test
    void authFailureShouldNotBeRetryable() throws Exception {
        String baseUrl = serve(401, "{\"error\":\"bad key\"}", new AtomicReference<>());

        ProviderException e = assertThrows(ProviderException.class, () -> provider(baseUrl).complete(request()));
        assertFalse(e.isRetryable());
        assertTrue(e.getMessage().contains("401"));
    }

    private String serve(int status, String body, AtomicReference<String> authorization) throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            exchange.getRequestBody().readAllBytes();
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        server.start();
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";
    }

    private OpenAiCompatibleProvider provider(String baseUrl) {
        return new OpenAiCompatibleProvider(mapper, HttpClient.newHttpClient(), "openai", baseUrl, "test-key",
            Duration.ofSeconds(5));
    }

    private static CompletionRequest request() {
        return CompletionRequest.builder()
            .model("gpt-4o-mini")
            .turns(List.of(Turn.builder().role(Role.USER).content("hello").tokenCount(2).build()))
            .build();
    }
}
