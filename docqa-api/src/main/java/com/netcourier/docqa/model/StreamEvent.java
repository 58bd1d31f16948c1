package com.netcourier.docqa.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One frame of a streamed answer. Which fields are populated depends on {@link #type()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEvent(StreamEventType type,
                          String message,
                          String content,
                          Long elapsedMillis,
                          Integer chunksUsed,
                          String backend,
                          String kind) {

    public static StreamEvent status(String message) {
        return new StreamEvent(StreamEventType.STATUS, message, null, null, null, null, null);
    }

    public static StreamEvent chunk(String content) {
        return new StreamEvent(StreamEventType.CHUNK, null, content, null, null, null, null);
    }

    public static StreamEvent complete(long elapsedMillis, int chunksUsed, String backend) {
        return new StreamEvent(StreamEventType.COMPLETE, null, null, elapsedMillis, chunksUsed, backend, null);
    }

    public static StreamEvent error(String kind, String message) {
        return new StreamEvent(StreamEventType.ERROR, message, null, null, null, null, kind);
    }
}
