package com.netcourier.docqa.service.error;

public class IndexUnavailableException extends RagException {

    public IndexUnavailableException(String message) {
        super(ErrorKind.INDEX_UNAVAILABLE, message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super(ErrorKind.INDEX_UNAVAILABLE, message, cause);
    }
}
