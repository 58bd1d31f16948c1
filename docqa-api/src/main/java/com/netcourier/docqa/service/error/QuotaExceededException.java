package com.netcourier.docqa.service.error;

public class QuotaExceededException extends RagException {

    public QuotaExceededException(String message) {
        super(ErrorKind.QUOTA_EXCEEDED, message);
    }
}
