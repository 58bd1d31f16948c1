package com.netcourier.docqa.service.ingestion;

import com.netcourier.docqa.config.RagProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy fixed-size windows whose right edge is pulled back onto the last line break or sentence
 * terminator found within {@code lookBack} characters. Consecutive windows share {@code overlap}
 * characters.
 */
@Component
public class SentenceAwareTextChunker implements TextChunker {

    private final int lookBack;

    @Autowired
    public SentenceAwareTextChunker(RagProperties properties) {
        this(properties.getChunking().getLookBack());
    }

    public SentenceAwareTextChunker(int lookBack) {
        if (lookBack < 0) {
            throw new IllegalArgumentException("lookBack must not be negative");
        }
        this.lookBack = lookBack;
    }

    @Override
    public List<Chunk> chunk(String text, ChunkingParameters parameters) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        int length = text.length();
        List<Chunk> chunks = new ArrayList<>();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + parameters.targetSize(), length);
            if (end < length) {
                end = snapToBoundary(text, start, end);
            }
            String window = text.substring(start, end).strip();
            if (!window.isEmpty()) {
                chunks.add(new Chunk(chunks.size(), window, Fingerprints.sha256(window), start, end,
                        parameters.targetSize(), parameters.overlap()));
            }
            if (end >= length) {
                break;
            }
            start = Math.max(end - parameters.overlap(), start + 1);
        }
        return List.copyOf(chunks);
    }

    private int snapToBoundary(String text, int start, int end) {
        int floor = Math.max(start, end - lookBack);
        for (int i = end - 1; i >= floor; i--) {
            if (isBoundary(text.charAt(i))) {
                return i + 1;
            }
        }
        return end;
    }

    private static boolean isBoundary(char c) {
        return c == '\n' || c == '.' || c == '!' || c == '?';
    }
}
