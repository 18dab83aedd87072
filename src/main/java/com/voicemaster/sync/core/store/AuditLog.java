package com.voicemaster.sync.core.store;

import com.voicemaster.sync.core.model.AuditEntry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only audit trail. Entries are never updated or deleted here.
 */
public interface AuditLog {

    Mono<Void> append(AuditEntry entry);

    /** The newest {@code count} entries of the guild, most recent first. */
    Flux<AuditEntry> latest(long guildId, int count);
}
