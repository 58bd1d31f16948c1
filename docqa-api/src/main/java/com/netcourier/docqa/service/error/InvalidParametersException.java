package com.netcourier.docqa.service.error;

public class InvalidParametersException extends RagException {

    public InvalidParametersException(String message) {
        super(ErrorKind.INVALID_PARAMETERS, message);
    }

    public InvalidParametersException(String message, Throwable cause) {
        super(ErrorKind.INVALID_PARAMETERS, message, cause);
    }
}
