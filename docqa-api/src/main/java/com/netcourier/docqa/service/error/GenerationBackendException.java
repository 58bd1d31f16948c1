package com.netcourier.docqa.service.error;

public class GenerationBackendException extends RagException {

    public GenerationBackendException(String message) {
        super(ErrorKind.GENERATION_BACKEND_FAILURE, message);
    }

    public GenerationBackendException(String message, Throwable cause) {
        super(ErrorKind.GENERATION_BACKEND_FAILURE, message, cause);
    }
}
