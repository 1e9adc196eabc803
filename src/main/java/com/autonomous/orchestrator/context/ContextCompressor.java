package com.autonomous.orchestrator.context;

import com.autonomous.orchestrator.config.ContextSettings;
import com.autonomous.orchestrator.exception.CompressionFailedException;
import com.autonomous.orchestrator.model.Role;
import com.autonomous.orchestrator.model.Turn;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a transcript under its token budget by folding older turns into one summary turn.
 *
 * <p>Callers invoke {@link #compressIfNeeded} only between a completed assistant turn and
 * the next inbound message. The transcript is split into a head and a tail window; the tail
 * is kept verbatim and the head is replaced by a single system turn. A tail larger than the
 * target is still kept whole, so the result may exceed the target ratio.
 */
@Slf4j
public class ContextCompressor {

    static final String SUMMARY_PREFIX = "[Compressed context summary]\n";

    private final ContextSettings settings;
    private final Summarizer summarizer;

    public ContextCompressor(ContextSettings settings, Summarizer summarizer) {
        this.settings = settings;
        this.summarizer = summarizer;
    }

    public boolean needsCompression(Transcript transcript) {
        return transcript.totalTokens() >= settings.thresholdTokens();
    }

    /**
     * Compresses when the transcript is at or above the threshold; otherwise leaves it untouched.
     *
     * @throws CompressionFailedException if summarization fails; the transcript is unchanged
     */
    public CompressionResult compressIfNeeded(Transcript transcript) {
        List<Turn> turns = transcript.turns();
        int before = transcript.totalTokens();
        if (before < settings.thresholdTokens()) {
            return CompressionResult.unchanged(before, turns.size());
        }

        int tailStart = tailStart(turns);
        if (tailStart == 0) {
            log.debug("Compression due ({} tokens) but every turn is in the tail window", before);
            return CompressionResult.unchanged(before, turns.size());
        }

        List<Turn> head = turns.subList(0, tailStart);
        List<Turn> tail = turns.subList(tailStart, turns.size());

        String summary;
        try {
            summary = summarizer.summarize(head);
        } catch (RuntimeException e) {
            throw new CompressionFailedException("Summarization failed: " + e.getMessage(), e);
        }
        if (summary == null || summary.isBlank()) {
            throw new CompressionFailedException("Summarization returned no text", null);
        }

        String content = SUMMARY_PREFIX + summary.trim();
        List<Turn> replacement = new ArrayList<>(tail.size() + 1);
        replacement.add(Turn.builder()
            .role(Role.SYSTEM)
            .content(content)
            .tokenCount(TokenEstimator.estimate(content))
            .build());
        replacement.addAll(tail);
        transcript.replaceAll(replacement);

        int after = transcript.totalTokens();
        log.info("Context compressed (#{}): {} turns summarized, {} kept, ~{} -> ~{} tokens",
            transcript.compressionCount(), head.size(), tail.size(), before, after);
        return new CompressionResult(true, head.size(), tail.size(), before, after);
    }

    /**
     * Index of the first tail turn. The tail always holds the newest {@code minTailTurns}
     * turns, grows backwards while it stays below the target, and never begins with a tool
     * result whose call would end up in the head.
     */
    int tailStart(List<Turn> turns) {
        int start = Math.max(0, turns.size() - Math.max(1, settings.getMinTailTurns()));
        int tokens = 0;
        for (int i = start; i < turns.size(); i++) {
            tokens += turns.get(i).getTokenCount();
        }
        int target = settings.targetTokens();
        while (start > 0 && tokens + turns.get(start - 1).getTokenCount() < target) {
            start--;
            tokens += turns.get(start).getTokenCount();
        }
        while (start > 0 && turns.get(start).getRole() == Role.TOOL) {
            start--;
        }
        return start;
    }
}
