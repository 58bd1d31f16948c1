package com.netcourier.docqa.service.ingestion;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serialises work per (owner, content fingerprint). Entries are reference counted and dropped once
 * the last holder leaves, so the map only ever holds keys with work in flight.
 */
@Component
public class IngestionLocks {

    private final ConcurrentMap<Key, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String ownerId, String fingerprint, Supplier<T> action) {
        Key key = new Key(ownerId, fingerprint);
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry current = existing == null ? new Entry() : existing;
            current.references++;
            return current;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, current) -> --current.references == 0 ? null : current);
        }
    }

    int activeKeys() {
        return locks.size();
    }

    private record Key(String ownerId, String fingerprint) {}

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;
    }
}
