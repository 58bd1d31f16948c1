package com.netcourier.docqa.service.generation;

import com.netcourier.docqa.service.retrieval.ContextChunk;

import java.util.List;
import java.util.stream.Collectors;

public final class PromptBuilder {

    public static final String NO_INFORMATION =
            "I don't have enough information to answer this question. Please upload relevant documents first.";

    public static final List<String> STOP_SEQUENCES = List.of("Question:", "Context:");

    private static final String INSTRUCTIONS = "Based on the following context, please answer the question. "
            + "If the context doesn't contain enough information to answer the question, please say so clearly. "
            + "Be concise and accurate.";

    private PromptBuilder() {
    }

    public static String systemPrompt() {
        return INSTRUCTIONS;
    }

    public static String userPrompt(GenerationRequest request) {
        String context = request.context().chunks().stream()
                .map(ContextChunk::text)
                .collect(Collectors.joining("\n\n"));
        return "Context:\n" + context + "\n\nQuestion: " + request.question() + "\n\nAnswer:";
    }

    public static String completionPrompt(GenerationRequest request) {
        return INSTRUCTIONS + "\n\n" + userPrompt(request);
    }
}
