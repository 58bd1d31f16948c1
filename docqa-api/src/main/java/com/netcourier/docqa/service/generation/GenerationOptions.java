package com.netcourier.docqa.service.generation;

import com.netcourier.docqa.service.error.InvalidParametersException;

public record GenerationOptions(double temperature, double topP, int maxOutputTokens) {

    public GenerationOptions {
        if (temperature < 0d || temperature > 2d) {
            throw new InvalidParametersException("temperature must be between 0 and 2");
        }
        if (topP <= 0d || topP > 1d) {
            throw new InvalidParametersException("topP must be in (0, 1]");
        }
        if (maxOutputTokens < 1) {
            throw new InvalidParametersException("maxOutputTokens must be at least 1");
        }
    }
}
