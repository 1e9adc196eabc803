package com.autonomous.orchestrator.context;

import com.autonomous.orchestrator.model.Turn;

import java.util.List;

@FunctionalInterface
public interface Summarizer {

    /**
     * Condenses {@code turns} into a single piece of text keeping facts, decisions and open items.
     */
    String summarize(List<Turn> turns);
}
