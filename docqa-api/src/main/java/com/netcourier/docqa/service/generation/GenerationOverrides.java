package com.netcourier.docqa.service.generation;

/**
 * Per-call sampling overrides; null fields keep the backend's own default.
 */
public record GenerationOverrides(Double temperature, Double topP, Integer maxOutputTokens) {

    private static final GenerationOverrides NONE = new GenerationOverrides(null, null, null);

    public static GenerationOverrides none() {
        return NONE;
    }

    public GenerationOptions applyTo(GenerationOptions defaults) {
        return new GenerationOptions(
                temperature == null ? defaults.temperature() : temperature,
                topP == null ? defaults.topP() : topP,
                maxOutputTokens == null ? defaults.maxOutputTokens() : maxOutputTokens);
    }
}
