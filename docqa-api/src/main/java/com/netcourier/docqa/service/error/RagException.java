package com.netcourier.docqa.service.error;

public class RagException extends RuntimeException {

    private final ErrorKind kind;

    public RagException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RagException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
