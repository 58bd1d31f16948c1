package com.netcourier.docqa.service.session;

public enum SessionEvent {
    START,
    CONTEXT_READY,
    FINISH,
    FAIL,
    CANCEL
}
