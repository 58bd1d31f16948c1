package com.netcourier.docqa.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StreamEventType {
    STATUS,
    CHUNK,
    COMPLETE,
    ERROR;

    @JsonValue
    public String eventName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
