package com.voicemaster.sync.coordinator;

import java.time.Duration;

/**
 * Thrown by {@link KeyedSections} when a section could not be entered within the wait bound.
 */
public class SectionTimeoutException extends RuntimeException {

    public SectionTimeoutException(Object key, Duration timeout) {
        super("Section " + key + " still busy after " + timeout.toMillis() + "ms");
    }

    public SectionTimeoutException(Object key, InterruptedException cause) {
        super("Interrupted while waiting for section " + key, cause);
    }
}
