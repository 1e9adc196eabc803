package com.autonomous.orchestrator.llm;

import com.autonomous.orchestrator.model.Role;
import com.autonomous.orchestrator.model.ToolCall;
import com.autonomous.orchestrator.model.Turn;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Adapter for the Anthropic messages API. Mid-conversation system turns (summaries,
 * model switch notices) are sent as user text since the API only takes one system prompt.
 */
public class AnthropicProvider extends AbstractHttpProvider {

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    private static final String API_VERSION = "2023-06-01";

    public AnthropicProvider(ObjectMapper mapper, HttpClient httpClient, String baseUrl, String apiKey,
                             Duration requestTimeout) {
        super(mapper, httpClient, "anthropic", baseUrl, apiKey, requestTimeout);
    }

    @Override
    public Completion complete(CompletionRequest request) {
        JsonNode response = postJson(baseUrl + "/messages", buildPayload(request),
            Map.of("x-api-key", apiKey, "anthropic-version", API_VERSION));
        return parseResponse(response, request.getModel());
    }

    ObjectNode buildPayload(CompletionRequest request) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", request.getModel());
        payload.put("max_tokens", request.getMaxOutputTokens());
        payload.put("temperature", request.getTemperature());
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            payload.put("system", request.getSystemPrompt());
        }

        ArrayNode messages = payload.putArray("messages");
        for (Turn turn : request.getTurns()) {
            ObjectNode message = messages.addObject();
            switch (turn.getRole()) {
                case SYSTEM -> {
                    message.put("role", "user");
                    message.put("content", "[system] " + turn.getContent());
                }
                case USER -> {
                    message.put("role", "user");
                    message.put("content", turn.getContent());
                }
                case ASSISTANT -> {
                    message.put("role", "assistant");
                    ArrayNode content = message.putArray("content");
                    if (turn.getContent() != null && !turn.getContent().isBlank()) {
                        content.addObject().put("type", "text").put("text", turn.getContent());
                    }
                    for (ToolCall call : turn.getToolCalls()) {
                        ObjectNode block = content.addObject();
                        block.put("type", "tool_use");
                        block.put("id", call.getId());
                        block.put("name", call.getName());
                        block.set("input", mapper.valueToTree(call.getArguments() == null ? Map.of() : call.getArguments()));
                    }
                }
                case TOOL -> {
                    message.put("role", "user");
                    message.putArray("content").addObject()
                        .put("type", "tool_result")
                        .put("tool_use_id", turn.getToolCallId())
                        .put("content", turn.getContent());
                }
            }
        }

        if (!request.getTools().isEmpty()) {
            ArrayNode tools = payload.putArray("tools");
            for (ToolDefinition tool : request.getTools()) {
                ObjectNode node = tools.addObject();
                node.put("name", tool.getName());
                node.put("description", tool.getDescription());
                node.set("input_schema", mapper.valueToTree(tool.getParameters()));
            }
        }
        return payload;
    }

    Completion parseResponse(JsonNode response, String model) {
        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode block : response.path("content")) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                text.append(block.path("text").asText());
            } else if ("tool_use".equals(type)) {
                Map<String, Object> input = mapper.convertValue(block.path("input"), MAP_TYPE);
                toolCalls.add(new ToolCall(block.path("id").asText(), block.path("name").asText(),
                    input == null ? Map.of() : input));
            }
        }
        JsonNode usage = response.path("usage");
        return Completion.builder()
            .text(text.toString())
            .toolCalls(toolCalls)
            .promptTokens(usage.path("input_tokens").asLong(0))
            .completionTokens(usage.path("output_tokens").asLong(0))
            .model(model)
            .finishReason(response.path("stop_reason").asText(""))
            .build();
    }
}
