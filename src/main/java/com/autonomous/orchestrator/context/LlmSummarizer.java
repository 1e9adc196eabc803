package com.autonomous.orchestrator.context;

import com.autonomous.orchestrator.config.ContextSettings;
import com.autonomous.orchestrator.llm.Completion;
import com.autonomous.orchestrator.llm.CompletionRequest;
import com.autonomous.orchestrator.llm.ProviderFactory;
import com.autonomous.orchestrator.model.Role;
import com.autonomous.orchestrator.model.Turn;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Summarizes with the configured compression model. Usage of each call is reported to
 * {@code usageSink} as (model, completion).
 */
public class LlmSummarizer implements Summarizer {

    private static final int MAX_CHARS_PER_TURN = 2000;

    private final ProviderFactory providers;
    private final ContextSettings settings;
    private final BiConsumer<String, Completion> usageSink;

    public LlmSummarizer(ProviderFactory providers, ContextSettings settings, BiConsumer<String, Completion> usageSink) {
        this.providers = providers;
        this.settings = settings;
        this.usageSink = usageSink;
    }

    @Override
    public String summarize(List<Turn> turns) {
        StringBuilder prompt = new StringBuilder(
            "Summarize the following conversation concisely, preserving key facts, decisions, "
                + "open items and commitments needed to continue it.\n\n");
        for (Turn turn : turns) {
            String content = turn.getContent() == null ? "" : turn.getContent();
            if (content.length() > MAX_CHARS_PER_TURN) {
                content = content.substring(0, MAX_CHARS_PER_TURN) + " ...";
            }
            prompt.append("**").append(turn.getRole().wireName()).append("**: ").append(content).append("\n\n");
        }

        String model = settings.getCompressModel();
        Completion completion = providers.forModel(model).complete(CompletionRequest.builder()
            .model(model)
            .turns(List.of(Turn.builder()
                .role(Role.USER)
                .content(prompt.toString())
                .tokenCount(TokenEstimator.estimate(prompt.toString()))
                .build()))
            .temperature(0.3)
            .maxOutputTokens(settings.getSummaryMaxOutputTokens())
            .build());
        usageSink.accept(model, completion);
        return completion.getText();
    }
}
