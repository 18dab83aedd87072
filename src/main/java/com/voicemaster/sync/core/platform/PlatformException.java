package com.voicemaster.sync.core.platform;

/**
 * Failure reported by a {@link PlatformGateway} call.
 */
public class PlatformException extends RuntimeException {

    public enum Kind {
        /** The platform (or the bridge in front of it) could not be reached or timed out. */
        UNAVAILABLE,
        /** The bot lacks the permission needed for the call. */
        FORBIDDEN,
        /** The referenced channel, category or member does not exist. */
        NOT_FOUND
    }

    private final Kind kind;

    public PlatformException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PlatformException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNotFound() {
        return kind == Kind.NOT_FOUND;
    }
}
