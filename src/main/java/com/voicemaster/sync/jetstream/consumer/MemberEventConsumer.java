package com.voicemaster.sync.jetstream.consumer;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voicemaster.sync.coordinator.LifecycleCoordinator;
import com.voicemaster.sync.coordinator.MemberMoveResult;
import com.voicemaster.sync.core.outcome.FailureKind;
import com.voicemaster.sync.core.outcome.Outcome;
import com.voicemaster.sync.core.platform.MemberMovedEvent;
import com.voicemaster.sync.jetstream.bootstrap.EventStreamReadyEvent;
import com.voicemaster.sync.jetstream.config.MemberEventsProperties;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Feeds membership-change events from a durable JetStream pull consumer into the
 * {@link LifecycleCoordinator}.
 *
 * <h2>Ordering and parallelism</h2>
 * <ul>
 *   <li>Each pulled batch is split into guild shards ({@code guildId mod shards}). Within a shard
 *       events are handled one after another in delivery order, which preserves per-channel FIFO.
 *       Shards run concurrently on the coordinator worker pool.</li>
 *   <li>The next batch is pulled only after the current one is fully handled.</li>
 * </ul>
 *
 * <h2>Acknowledgement policy</h2>
 * <ul>
 *   <li>Handled events are acked, including events that ended in a permanent failure (those
 *       are visible in the audit log).</li>
 *   <li>Events that failed transiently (busy section, store or platform unavailable) are nak'ed
 *       with {@code redelivery-delay} so the server redelivers them without spinning on a busy
 *       channel. Redelivery is safe: leave handling is idempotent and duplicate
 *       joins are debounced.</li>
 *   <li>Payloads that cannot be decoded are terminated; redelivering them cannot succeed.</li>
 * </ul>
 *
 * <p>Like the other background loops it never crashes the Spring context: subscription failures
 * are logged and retried.</p>
 */
@Component
@ConditionalOnProperty(prefix = "voicemaster.events", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MemberEventConsumer implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(MemberEventConsumer.class);

    /** JetStream API error code for "stream not found". */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private static final Duration SUBSCRIBE_RETRY_INTERVAL = Duration.ofSeconds(2);

    private static final Duration NEXT_MESSAGE_POLL = Duration.ofMillis(250);

    private static final Set<FailureKind> TRANSIENT = EnumSet.of(
            FailureKind.BUSY,
            FailureKind.STORE_UNAVAILABLE,
            FailureKind.PLATFORM_UNAVAILABLE);

    /** What happened to one delivered message. */
    enum Disposition {
        ACKED,
        NAKED,
        TERMINATED
    }

    private final JetStream js;
    private final LifecycleCoordinator coordinator;
    private final ObjectMapper mapper;
    private final MemberEventsProperties props;
    private final Scheduler workers;

    private final AtomicReference<Disposable> running = new AtomicReference<>();

    public MemberEventConsumer(
            JetStream js,
            LifecycleCoordinator coordinator,
            ObjectMapper mapper,
            MemberEventsProperties props,
            Scheduler coordinatorWorkers
    ) {
        this.js = js;
        this.coordinator = coordinator;
        this.mapper = mapper;
        this.props = props;
        this.workers = coordinatorWorkers;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        startIfNotStarted();
    }

    @EventListener(EventStreamReadyEvent.class)
    public void onStreamReady() {
        startIfNotStarted();
    }

    private void startIfNotStarted() {
        if (running.get() != null) {
            return;
        }

        final ConsumerConfiguration consumerConfig = ConsumerConfiguration.builder()
                .durable(props.getDurable())
                .deliverPolicy(DeliverPolicy.All)
                .ackPolicy(AckPolicy.Explicit)
                .filterSubject(props.getFilterSubject())
                .build();

        final PullSubscribeOptions pso = PullSubscribeOptions.builder()
                .stream(props.getStream())
                .configuration(consumerConfig)
                .build();

        Disposable d = Flux.interval(Duration.ZERO, SUBSCRIBE_RETRY_INTERVAL)
                .publishOn(Schedulers.boundedElastic())
                .concatMap(tick -> subscribeAndConsumeOnce(pso)
                        .onErrorResume(err -> {
                            log.warn("Event loop ended with error. Will retry subscription. stream={} durable={} err={}",
                                    props.getStream(), props.getDurable(), err.toString());
                            return Mono.empty();
                        }))
                .subscribe(
                        v -> { },
                        err -> log.error("Event consumer supervisor terminated unexpectedly: {}", err.toString(), err)
                );

        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
    }

    private Mono<Void> subscribeAndConsumeOnce(PullSubscribeOptions pso) {
        return Mono.fromCallable(() -> {
                    try {
                        JetStreamSubscription sub = js.subscribe(props.getFilterSubject(), pso);
                        log.info("Subscribed: stream={} filter={} durable={}",
                                props.getStream(), props.getFilterSubject(), props.getDurable());
                        return sub;
                    } catch (JetStreamApiException jse) {
                        if (jse.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR) {
                            log.warn("Waiting for stream to exist: stream={}. Will retry...", props.getStream());
                            return null;
                        }
                        throw jse;
                    }
                })
                .flatMap(sub -> consumePullLoop(sub)
                        .doFinally(sig -> {
                            try {
                                sub.unsubscribe();
                            } catch (IllegalStateException e) {
                                log.debug("Unsubscribe failed: {}", e.toString());
                            }
                        }));
    }

    /**
     * Pull, drain, handle, repeat. A failing pull propagates so the supervisor resubscribes.
     */
    private Mono<Void> consumePullLoop(JetStreamSubscription sub) {
        return Flux.interval(props.getPollInterval())
                .onBackpressureDrop()
                .concatMap(t -> Mono.fromRunnable(() -> sub.pull(props.getBatchSize()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .thenMany(drain(sub))
                        .collectList()
                        .flatMap(batch -> handleBatch(Flux.fromIterable(batch)).then()), 1)
                .then();
    }

    private Flux<Message> drain(JetStreamSubscription sub) {
        return Flux.<Message>generate(sink -> {
                    try {
                        Message m = sub.nextMessage(NEXT_MESSAGE_POLL);
                        if (m == null) {
                            sink.complete();
                        } else {
                            sink.next(m);
                        }
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        sink.complete();
                    } catch (RuntimeException e) {
                        sink.error(e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Handles one batch: messages are decoded, grouped by guild shard, and each shard is handled
     * sequentially. Emits the disposition of every message.
     */
    Flux<Disposition> handleBatch(Flux<Message> batch) {
        int shards = Math.max(1, props.getShards());
        return batch
                .map(msg -> new Delivery(msg, decode(msg.getData())))
                .groupBy(d -> d.event() == null ? 0 : Math.floorMod(d.event().guildId(), (long) shards))
                .flatMap(shard -> shard.concatMap(this::handle), shards);
    }

    private Mono<Disposition> handle(Delivery delivery) {
        Message msg = delivery.msg();
        MemberMovedEvent event = delivery.event();
        if (event == null) {
            log.warn("Undecodable member event terminated subject={} bytes={}",
                    msg.getSubject(), msg.getData() == null ? 0 : msg.getData().length);
            msg.term();
            return Mono.just(Disposition.TERMINATED);
        }

        return Mono.fromCallable(() -> coordinator.onMemberMoved(event))
                .subscribeOn(workers)
                .map(result -> {
                    if (isTransient(result)) {
                        log.warn("Member event for guild={} user={} failed transiently; requesting redelivery. result={}",
                                event.guildId(), event.userId(), result);
                        msg.nakWithDelay(props.getRedeliveryDelay());
                        return Disposition.NAKED;
                    }
                    msg.ack();
                    return Disposition.ACKED;
                })
                .onErrorResume(err -> {
                    // Not acked: the server redelivers after the ack wait.
                    log.warn("Member event handling failed; message not acked. err={}", err.toString(), err);
                    return Mono.empty();
                });
    }

    /** {@code null} when the payload is not a usable member event. */
    MemberMovedEvent decode(byte[] data) {
        if (data == null || data.length == 0) {
            return null;
        }
        try {
            MemberMovedEvent event = mapper.readValue(data, MemberMovedEvent.class);
            if (event.guildId() <= 0 || event.userId() <= 0) {
                return null;
            }
            return event;
        } catch (IOException e) {
            log.debug("Member event decode failed: {}", e.getMessage());
            return null;
        }
    }

    private static boolean isTransient(MemberMoveResult result) {
        return isTransient(result.leave()) || isTransient(result.join());
    }

    private static boolean isTransient(Outcome<?> outcome) {
        return outcome != null && !outcome.isSuccess() && TRANSIENT.contains(outcome.failure());
    }

    private record Delivery(Message msg, MemberMovedEvent event) {
    }

    @Override
    public void destroy() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
