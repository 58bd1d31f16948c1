package com.netcourier.docqa.service.error;

public class EmbeddingUnavailableException extends RagException {

    public EmbeddingUnavailableException(String message) {
        super(ErrorKind.EMBEDDING_UNAVAILABLE, message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(ErrorKind.EMBEDDING_UNAVAILABLE, message, cause);
    }
}
