package com.voicemaster.sync.coordinator;

import java.util.Optional;

/**
 * Validation of user-supplied channel names and limits against the platform maxima.
 */
public final class ChannelConstraints {

    private final int maxUserLimit;
    private final int maxNameLength;

    public ChannelConstraints(int maxUserLimit, int maxNameLength) {
        this.maxUserLimit = maxUserLimit;
        this.maxNameLength = maxNameLength;
    }

    public static ChannelConstraints from(CoordinatorProperties props) {
        return new ChannelConstraints(props.getMaxUserLimit(), props.getMaxNameLength());
    }

    /** Problem description, or empty when the limit is acceptable. 0 means unlimited. */
    public Optional<String> checkLimit(int limit) {
        if (limit < 0 || limit > maxUserLimit) {
            return Optional.of("Limit must be between 0 (unlimited) and " + maxUserLimit + ", got " + limit);
        }
        return Optional.empty();
    }

    public Optional<String> checkName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.of("Name must not be blank");
        }
        if (name.strip().length() > maxNameLength) {
            return Optional.of("Name must be at most " + maxNameLength + " characters");
        }
        return Optional.empty();
    }

    public int maxUserLimit() {
        return maxUserLimit;
    }

    public int maxNameLength() {
        return maxNameLength;
    }
}
