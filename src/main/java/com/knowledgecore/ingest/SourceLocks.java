package com.knowledgecore.ingest;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutex per source so ingest and delete of the same document never interleave, while different
 * documents proceed in parallel. Entries are dropped once no thread holds or waits for them.
 */
final class SourceLocks {
    private final Map<String, Entry> locks = new HashMap<>();

    <T> T withLock(String source, Supplier<T> action) {
        Entry entry;
        synchronized (locks) {
            entry = locks.computeIfAbsent(source, unused -> new Entry());
            entry.users++;
        }
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            synchronized (locks) {
                entry.users--;
                if (entry.users == 0) {
                    locks.remove(source);
                }
            }
        }
    }

    int trackedSources() {
        synchronized (locks) {
            return locks.size();
        }
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
