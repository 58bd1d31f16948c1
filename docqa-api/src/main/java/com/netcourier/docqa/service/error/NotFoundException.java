package com.netcourier.docqa.service.error;

public class NotFoundException extends RagException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
