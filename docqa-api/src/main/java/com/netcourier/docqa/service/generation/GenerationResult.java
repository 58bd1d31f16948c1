package com.netcourier.docqa.service.generation;

import java.util.List;

public record GenerationResult(String text, String backend, List<String> fallbacks) {

    public GenerationResult {
        fallbacks = List.copyOf(fallbacks);
    }
}
