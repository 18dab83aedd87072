package com.voicemaster.sync.r2dbc.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.voicemaster.sync.core.store.UnitOfWork;

import reactor.core.publisher.Mono;

/**
 * Runs store writes in one R2DBC transaction.
 *
 * Platform calls never happen inside it; the coordinator issues them before the commit.
 */
@Service
public class R2dbcUnitOfWork implements UnitOfWork {

    private final TransactionalOperator tx;

    public R2dbcUnitOfWork(ReactiveTransactionManager transactionManager) {
        this.tx = TransactionalOperator.create(transactionManager);
    }

    @Override
    public <T> Mono<T> atomically(Mono<T> work) {
        return tx.transactional(work);
    }
}
