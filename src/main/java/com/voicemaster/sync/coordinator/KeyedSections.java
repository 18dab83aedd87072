package com.voicemaster.sync.coordinator;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion per key (channel id, guild id, member).
 *
 * <p>Sections are created on first use and dropped once no thread holds or waits for them, so
 * the table only ever contains keys with in-flight work. Locks are fair: waiters enter in arrival
 * order. Sections are reentrant for the owning thread.</p>
 */
public final class KeyedSections<K> {

    private static final class Section {
        final ReentrantLock lock = new ReentrantLock(true);
        int users;
    }

    private final String name;
    private final ConcurrentHashMap<K, Section> sections = new ConcurrentHashMap<>();

    public KeyedSections(String name) {
        this.name = name;
    }

    /**
     * Runs {@code body} while holding the section for {@code key}.
     *
     * @throws SectionTimeoutException if the section is not free within {@code timeout}
     */
    public <T> T call(K key, Duration timeout, Supplier<T> body) {
        Section section = sections.compute(key, (k, current) -> {
            Section s = current == null ? new Section() : current;
            s.users++;
            return s;
        });

        boolean acquired = false;
        try {
            try {
                acquired = section.lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new SectionTimeoutException(name + ":" + key, ie);
            }
            if (!acquired) {
                throw new SectionTimeoutException(name + ":" + key, timeout);
            }
            return body.get();
        } finally {
            if (acquired) {
                section.lock.unlock();
            }
            sections.computeIfPresent(key, (k, current) -> --current.users == 0 ? null : current);
        }
    }

    /** Number of keys with a holder or waiter. */
    public int activeKeys() {
        return sections.size();
    }
}
