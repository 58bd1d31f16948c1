package com.netcourier.docqa.service.generation;

import com.netcourier.docqa.model.BackendsResponse.BackendDescriptor;
import com.netcourier.docqa.service.generation.openai.OpenAiChatClient;
import com.netcourier.docqa.service.generation.openai.OpenAiChatException;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Hosted OpenAI-compatible chat model. Without an API key every call fails fast so the chain moves on.
 */
public class OpenAiGenerationBackend implements GenerationBackend {

    public static final String NAME = "openai";

    private final OpenAiChatClient chatClient;
    private final String model;
    private final boolean configured;
    private final GenerationOptions defaults;

    public OpenAiGenerationBackend(OpenAiChatClient chatClient, String model, boolean configured, GenerationOptions defaults) {
        this.chatClient = chatClient;
        this.model = model;
        this.configured = configured;
        this.defaults = defaults;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String generate(GenerationRequest request) {
        if (request.context().isEmpty()) {
            return PromptBuilder.NO_INFORMATION;
        }
        requireConfigured();
        String content = chatClient.complete(chatRequest(request)).firstChoice().message().content();
        return content == null ? "" : content.strip();
    }

    @Override
    public Flux<String> stream(GenerationRequest request) {
        if (request.context().isEmpty()) {
            return Flux.just(PromptBuilder.NO_INFORMATION);
        }
        return Flux.defer(() -> {
            requireConfigured();
            return chatClient.stream(chatRequest(request));
        });
    }

    @Override
    public BackendDescriptor describe() {
        return new BackendDescriptor(NAME, "hosted", model, configured);
    }

    private void requireConfigured() {
        if (!configured) {
            throw new OpenAiChatException("No API key configured for " + NAME);
        }
    }

    private OpenAiChatClient.Request chatRequest(GenerationRequest request) {
        GenerationOptions options = request.overrides().applyTo(defaults);
        List<OpenAiChatClient.Message> messages = List.of(
                new OpenAiChatClient.Message("system", PromptBuilder.systemPrompt()),
                new OpenAiChatClient.Message("user", PromptBuilder.userPrompt(request)));
        return new OpenAiChatClient.Request(model, messages, options.temperature(), options.topP(),
                options.maxOutputTokens(), PromptBuilder.STOP_SEQUENCES);
    }
}
