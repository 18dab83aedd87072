package com.voicemaster.sync.coordinator;

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Periodically tears down tracked channels that are empty but whose last leave event was lost or
 * whose teardown failed.
 *
 * Passes never overlap: a pass that outlasts the interval delays the next tick.
 */
@Component
@ConditionalOnProperty(prefix = "voicemaster.coordinator", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class ChannelSweeper implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ChannelSweeper.class);

    private final LifecycleCoordinator coordinator;
    private final CoordinatorProperties props;
    private final Scheduler workers;

    private final AtomicReference<Disposable> running = new AtomicReference<>();

    public ChannelSweeper(LifecycleCoordinator coordinator, CoordinatorProperties props, Scheduler coordinatorWorkers) {
        this.coordinator = coordinator;
        this.props = props;
        this.workers = coordinatorWorkers;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (running.get() != null) {
            return;
        }
        Disposable d = Flux.interval(props.getSweepInterval(), props.getSweepInterval())
                .onBackpressureDrop()
                .concatMap(tick -> Mono.fromCallable(coordinator::sweep).subscribeOn(workers), 1)
                .subscribe(
                        outcome -> {
                            if (!outcome.isSuccess()) {
                                log.warn("Sweep failed: {} {}", outcome.failure(), outcome.detail());
                            } else if (outcome.value() > 0) {
                                log.info("Sweep tore down {} empty channels", outcome.value());
                            }
                        },
                        err -> log.error("Channel sweeper terminated unexpectedly: {}", err.toString(), err));
        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
    }

    @Override
    public void destroy() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
