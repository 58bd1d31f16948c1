package com.netcourier.docqa.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * A question plus optional per-call overrides. Unset fields use the configured defaults.
 */
public record AskRequest(@NotBlank @Size(max = 2000) String question,
                         @Min(1) @Max(50) Integer topK,
                         @Min(1) Integer maxContextLength,
                         @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
                         @DecimalMin("0.0") @DecimalMax("1.0") Double topP,
                         @Min(1) @Max(4096) Integer maxOutputTokens,
                         List<Long> documentIds) {

    public static AskRequest of(String question) {
        return new AskRequest(question, null, null, null, null, null, null);
    }
}
