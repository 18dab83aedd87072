package com.voicemaster.sync.core.outcome;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a coordinator operation: either a value (possibly {@code null} for operations
 * with nothing to return) or a {@link FailureKind} with a human-readable detail.
 */
public record Outcome<T>(T value, FailureKind failure, String detail) {

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(value, null, null);
    }

    public static <T> Outcome<T> ok(T value, String detail) {
        return new Outcome<>(value, null, detail);
    }

    public static <T> Outcome<T> fail(FailureKind failure, String detail) {
        return new Outcome<>(null, Objects.requireNonNull(failure, "failure"), detail);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean failedWith(FailureKind kind) {
        return failure == kind;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> fn) {
        return isSuccess() ? new Outcome<>(fn.apply(value), null, detail) : Outcome.fail(failure, detail);
    }

    /** Re-types a failed outcome. Must only be called on failures. */
    public <R> Outcome<R> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("propagate() called on a successful outcome");
        }
        return Outcome.fail(failure, detail);
    }
}
