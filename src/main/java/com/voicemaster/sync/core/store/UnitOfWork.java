package com.voicemaster.sync.core.store;

import reactor.core.publisher.Mono;

/**
 * Runs several store writes as one atomic unit (for example a registry row change together
 * with its audit entry).
 *
 * <p>The given publisher must be assembled lazily from store calls; it is subscribed to inside
 * the transaction scope and rolled back as a whole if any part errors.</p>
 */
public interface UnitOfWork {

    <T> Mono<T> atomically(Mono<T> work);
}
