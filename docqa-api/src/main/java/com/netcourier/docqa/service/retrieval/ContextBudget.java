package com.netcourier.docqa.service.retrieval;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy character budget. Chunks are taken in the given order until the next one would not fit;
 * nothing after that point is considered.
 */
public class ContextBudget {

    private final int maxLength;

    public ContextBudget(int maxLength) {
        this.maxLength = maxLength;
    }

    public ContextBundle assemble(String question, List<ContextChunk> ranked) {
        int remaining = maxLength;
        List<ContextChunk> accepted = new ArrayList<>();
        for (ContextChunk chunk : ranked) {
            int length = chunk.text().length();
            if (length > remaining) {
                break;
            }
            remaining -= length;
            accepted.add(chunk);
        }
        return new ContextBundle(question, accepted, maxLength - remaining);
    }
}
