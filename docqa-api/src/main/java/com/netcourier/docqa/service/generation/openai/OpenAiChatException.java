package com.netcourier.docqa.service.generation.openai;

import com.netcourier.docqa.service.error.GenerationBackendException;

public class OpenAiChatException extends GenerationBackendException {

    public OpenAiChatException(String message) {
        super(message);
    }

    public OpenAiChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
