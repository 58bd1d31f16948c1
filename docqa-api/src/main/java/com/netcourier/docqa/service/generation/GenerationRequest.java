package com.netcourier.docqa.service.generation;

import com.netcourier.docqa.service.retrieval.ContextBundle;

public record GenerationRequest(String question, ContextBundle context, GenerationOverrides overrides) {

    public GenerationRequest {
        overrides = overrides == null ? GenerationOverrides.none() : overrides;
    }

    public GenerationRequest(String question, ContextBundle context) {
        this(question, context, GenerationOverrides.none());
    }
}
