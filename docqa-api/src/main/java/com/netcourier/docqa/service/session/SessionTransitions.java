package com.netcourier.docqa.service.session;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The complete transition table of a streaming session. Pairs that are absent are rejected.
 */
public final class SessionTransitions {

    private static final Map<SessionState, Map<SessionEvent, SessionState>> TABLE = new EnumMap<>(SessionState.class);

    static {
        allow(SessionState.INIT, SessionEvent.START, SessionState.SEARCHING);
        allow(SessionState.INIT, SessionEvent.CANCEL, SessionState.CANCELLED);
        allow(SessionState.SEARCHING, SessionEvent.CONTEXT_READY, SessionState.GENERATING);
        allow(SessionState.SEARCHING, SessionEvent.FAIL, SessionState.ERRORED);
        allow(SessionState.SEARCHING, SessionEvent.CANCEL, SessionState.CANCELLED);
        allow(SessionState.GENERATING, SessionEvent.FINISH, SessionState.COMPLETED);
        allow(SessionState.GENERATING, SessionEvent.FAIL, SessionState.ERRORED);
        allow(SessionState.GENERATING, SessionEvent.CANCEL, SessionState.CANCELLED);
    }

    private SessionTransitions() {
    }

    public static Optional<SessionState> next(SessionState from, SessionEvent event) {
        return Optional.ofNullable(TABLE.getOrDefault(from, Map.of()).get(event));
    }

    private static void allow(SessionState from, SessionEvent event, SessionState to) {
        TABLE.computeIfAbsent(from, state -> new EnumMap<>(SessionEvent.class)).put(event, to);
    }
}
