package com.netcourier.docqa.model;

import java.util.List;

/**
 * @param fallbacks one {@code "from -> to"} entry per backend hop taken before {@code backend} answered
 */
public record AnswerResponse(String answer,
                             long elapsedMillis,
                             List<String> chunkIds,
                             String backend,
                             List<String> fallbacks) {
}
