package com.autonomous.orchestrator.context;

import com.autonomous.orchestrator.model.Role;
import com.autonomous.orchestrator.model.ToolCall;
import com.autonomous.orchestrator.model.Turn;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered conversation turns of one worker. Turns are only ever appended; the whole
 * sequence is replaced at once by compression or cleared by a reset.
 *
 * <p>Not thread-safe: a transcript belongs to the single thread of its worker.
 */
public class Transcript {

    private List<Turn> turns = new ArrayList<>();
    private int compressionCount;

    public Turn append(Role role, String content) {
        return append(Turn.builder()
            .role(role)
            .content(content)
            .tokenCount(TokenEstimator.estimate(content))
            .build());
    }

    public Turn appendAssistant(String content, List<ToolCall> toolCalls) {
        return append(Turn.builder()
            .role(Role.ASSISTANT)
            .content(content)
            .tokenCount(TokenEstimator.estimate(content))
            .toolCalls(List.copyOf(toolCalls))
            .build());
    }

    public Turn appendToolResult(ToolCall call, String output) {
        return append(Turn.builder()
            .role(Role.TOOL)
            .content(output)
            .tokenCount(TokenEstimator.estimate(output))
            .toolCallId(call.getId())
            .toolName(call.getName())
            .build());
    }

    public Turn append(Turn turn) {
        turns.add(turn);
        return turn;
    }

    void replaceAll(List<Turn> replacement) {
        turns = new ArrayList<>(replacement);
        compressionCount++;
    }

    public void clear() {
        turns = new ArrayList<>();
    }

    public List<Turn> turns() {
        return List.copyOf(turns);
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    public int totalTokens() {
        int total = 0;
        for (Turn turn : turns) {
            total += turn.getTokenCount();
        }
        return total;
    }

    public int compressionCount() {
        return compressionCount;
    }
}
