package com.voicemaster.sync.coordinator;

import java.util.function.Supplier;

import org.slf4j.Logger;

import com.voicemaster.sync.core.outcome.FailureKind;
import com.voicemaster.sync.core.outcome.Outcome;
import com.voicemaster.sync.core.platform.PlatformException;
import com.voicemaster.sync.core.store.StoreUnavailableException;

/**
 * Converts the exceptions used inside the coordinator into typed outcomes at its boundary.
 */
final class Outcomes {

    private Outcomes() {
    }

    static <T> Outcome<T> guarded(Logger log, String operation, Supplier<Outcome<T>> body) {
        try {
            return body.get();
        } catch (SectionTimeoutException e) {
            log.warn("{} rejected: {}", operation, e.getMessage());
            return Outcome.fail(FailureKind.BUSY, e.getMessage());
        } catch (StoreUnavailableException e) {
            log.warn("{} failed, store unavailable: {}", operation, e.getMessage());
            return Outcome.fail(FailureKind.STORE_UNAVAILABLE, e.getMessage());
        } catch (PlatformException e) {
            log.warn("{} failed, platform {}: {}", operation, e.getKind(), e.getMessage());
            return fromPlatform(e);
        }
    }

    /** A vanished channel reads as "not tracked" from the caller's point of view. */
    static <T> Outcome<T> fromPlatform(PlatformException e) {
        return switch (e.getKind()) {
            case UNAVAILABLE -> Outcome.fail(FailureKind.PLATFORM_UNAVAILABLE, e.getMessage());
            case FORBIDDEN -> Outcome.fail(FailureKind.FORBIDDEN, e.getMessage());
            case NOT_FOUND -> Outcome.fail(FailureKind.NOT_TRACKED, e.getMessage());
        };
    }
}
