package com.autonomous.orchestrator.llm;

import com.autonomous.orchestrator.exception.ProviderException;
import com.autonomous.orchestrator.model.Role;
import com.autonomous.orchestrator.model.ToolCall;
import com.autonomous.orchestrator.model.Turn;
import com.fasterxml.jackson.core.JsonProcessingException;
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
 * Chat-completions adapter for every endpoint speaking the OpenAI wire format.
 * Handles: openai, openrouter, xai, google (through its OpenAI-compatible endpoint).
 */
public class OpenAiCompatibleProvider extends AbstractHttpProvider {

    public OpenAiCompatibleProvider(ObjectMapper mapper, HttpClient httpClient, String providerName,
                                    String baseUrl, String apiKey, Duration requestTimeout) {
        super(mapper, httpClient, providerName, baseUrl, apiKey, requestTimeout);
    }

    public static String defaultBaseUrl(String provider) {
        switch (provider) {
            case "openai":
                return "https://api.openai.com/v1";
            case "openrouter":
                return "https://openrouter.ai/api/v1";
            case "xai":
                return "https://api.x.ai/v1";
            case "google":
                return "https://generativelanguage.googleapis.com/v1beta/openai";
            default:
                return "http://localhost:1234/v1";
        }
    }

    @Override
    public Completion complete(CompletionRequest request) {
        ObjectNode payload = buildPayload(request);
        JsonNode response = postJson(baseUrl + "/chat/completions", payload,
            Map.of("Authorization", "Bearer " + apiKey));
        return parseResponse(response, request.getModel());
    }

    ObjectNode buildPayload(CompletionRequest request) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", request.getModel());
        payload.put("temperature", request.getTemperature());
        payload.put("max_tokens", request.getMaxOutputTokens());

        ArrayNode messages = payload.putArray("messages");
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.addObject().put("role", "system").put("content", request.getSystemPrompt());
        }
        for (Turn turn : request.getTurns()) {
            ObjectNode message = messages.addObject();
            message.put("role", turn.getRole().wireName());
            message.put("content", turn.getContent());
            if (turn.getRole() == Role.TOOL) {
                message.put("tool_call_id", turn.getToolCallId());
            }
            if (turn.getRole() == Role.ASSISTANT && turn.hasToolCalls()) {
                ArrayNode calls = message.putArray("tool_calls");
                for (ToolCall call : turn.getToolCalls()) {
                    ObjectNode node = calls.addObject();
                    node.put("id", call.getId());
                    node.put("type", "function");
                    node.putObject("function")
                        .put("name", call.getName())
                        .put("arguments", writeArguments(call.getArguments()));
                }
            }
        }

        if (!request.getTools().isEmpty()) {
            ArrayNode tools = payload.putArray("tools");
            for (ToolDefinition tool : request.getTools()) {
                ObjectNode function = tools.addObject().put("type", "function").putObject("function");
                function.put("name", tool.getName());
                function.put("description", tool.getDescription());
                function.set("parameters", mapper.valueToTree(tool.getParameters()));
            }
            payload.put("tool_choice", "auto");
        }
        return payload;
    }

    Completion parseResponse(JsonNode response, String model) {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ProviderException(providerName + " returned no choices", false);
        }
        JsonNode choice = choices.get(0);
        JsonNode message = choice.path("message");

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            toolCalls.add(new ToolCall(call.path("id").asText(), function.path("name").asText(),
                parseArguments(function.path("arguments").asText(null))));
        }

        JsonNode usage = response.path("usage");
        return Completion.builder()
            .text(message.path("content").isTextual() ? message.path("content").asText() : "")
            .toolCalls(toolCalls)
            .promptTokens(usage.path("prompt_tokens").asLong(0))
            .completionTokens(usage.path("completion_tokens").asLong(0))
            .model(model)
            .finishReason(choice.path("finish_reason").asText(""))
            .build();
    }

    private String writeArguments(Map<String, Object> arguments) {
        try {
            return mapper.writeValueAsString(arguments == null ? Map.of() : arguments);
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }
}
