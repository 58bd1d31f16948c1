package com.netcourier.docqa.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record IngestTextRequest(@NotBlank @Size(max = 255) String title,
                                @NotBlank String text,
                                @Min(1) @Max(20000) Integer chunkSize,
                                @Min(0) Integer overlap) {
}
