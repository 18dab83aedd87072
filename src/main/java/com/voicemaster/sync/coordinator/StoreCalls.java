package com.voicemaster.sync.coordinator;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.voicemaster.sync.core.model.AuditEntry;
import com.voicemaster.sync.core.store.AuditLog;
import com.voicemaster.sync.core.store.StoreUnavailableException;

import reactor.core.publisher.Mono;

/**
 * Bridges the reactive store contracts into the coordinator's worker threads.
 *
 * <p>Callers run on bounded-elastic workers, where blocking is allowed. Every error coming out of
 * a store publisher, including the timeout, surfaces as {@link StoreUnavailableException}.</p>
 */
final class StoreCalls {

    private static final Logger log = LoggerFactory.getLogger(StoreCalls.class);

    private final Duration timeout;
    private final AuditLog auditLog;

    StoreCalls(Duration timeout, AuditLog auditLog) {
        this.timeout = timeout;
        this.auditLog = auditLog;
    }

    /** Blocks for the result; {@code null} when the publisher completes empty. */
    <T> T await(Mono<T> mono) {
        return mono.timeout(timeout)
                .onErrorMap(TimeoutException.class,
                        e -> new StoreUnavailableException("Store call timed out after " + timeout.toMillis() + "ms", e))
                .onErrorMap(e -> !(e instanceof StoreUnavailableException),
                        e -> new StoreUnavailableException("Store call failed: " + e.getMessage(), e))
                .block();
    }

    /**
     * Appends an audit entry outside any unit of work. Used for entries that must not decide the
     * outcome of the operation they describe (failure records, leave notices, list queries).
     */
    void auditQuietly(AuditEntry entry) {
        try {
            await(auditLog.append(entry));
        } catch (StoreUnavailableException e) {
            log.warn("Audit entry dropped guild={} type={} channel={} err={}",
                    entry.guildId(), entry.eventType(), entry.channelId(), e.getMessage());
        }
    }
}
