package com.netcourier.docqa.service.session;

public enum SessionState {
    INIT,
    SEARCHING,
    GENERATING,
    COMPLETED,
    ERRORED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERRORED || this == CANCELLED;
    }
}
