package com.voicemaster.sync.jetstream.bootstrap;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.voicemaster.sync.coordinator.StartupReconciler;
import com.voicemaster.sync.jetstream.config.MemberEventsProperties;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;

/**
 * Ensures the member event stream exists.
 *
 * <h2>Who should enable this</h2>
 * Only the node that owns the stream ({@code voicemaster.events.bootstrap-stream=true}). In most
 * deployments the platform bridge creates it and this stays off.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Missing stream: created as a file-backed limits stream over the filter subject.</li>
 *   <li>Existing stream: compared against the expected shape; differences are logged, never
 *       changed, because altering a stream with data in it can break redelivery.</li>
 *   <li>Permission or connectivity errors fail startup.</li>
 * </ul>
 */
@Component
@Order(StartupReconciler.ORDER + 1)
@ConditionalOnProperty(prefix = "voicemaster.events", name = "bootstrap-stream", havingValue = "true")
public class EventStreamBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(EventStreamBootstrapper.class);

    /** JetStream API error code for "stream not found". Message text is not relied on. */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStreamManagement jsm;
    private final MemberEventsProperties props;
    private final ApplicationEventPublisher publisher;

    public EventStreamBootstrapper(
            JetStreamManagement jsm,
            MemberEventsProperties props,
            ApplicationEventPublisher publisher
    ) {
        this.jsm = jsm;
        this.props = props;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        ensureStream(desiredConfig());
        publisher.publishEvent(new EventStreamReadyEvent());
        log.info("Event stream bootstrap complete (published EventStreamReadyEvent)");
    }

    void ensureStream(StreamConfiguration desired) throws Exception {
        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            List<String> diffs = differences(desired, existing.getConfiguration());
            if (diffs.isEmpty()) {
                log.info("Event stream exists and matches config: {} (subjects={})",
                        desired.getName(), desired.getSubjects());
            } else {
                log.warn("Event stream exists but differs from expected: {} :: {}",
                        desired.getName(), String.join("; ", diffs));
            }
            return;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
        }

        jsm.addStream(desired);
        log.info("Created event stream: {} (subjects={}, maxAge={}, storage={})",
                desired.getName(), desired.getSubjects(), desired.getMaxAge(), desired.getStorageType());
    }

    StreamConfiguration desiredConfig() {
        return StreamConfiguration.builder()
                .name(props.getStream())
                .subjects(props.getFilterSubject())
                .retentionPolicy(RetentionPolicy.Limits)
                .storageType(StorageType.File)
                .maxAge(props.getMaxAge())
                .build();
    }

    static List<String> differences(StreamConfiguration desired, StreamConfiguration actual) {
        List<String> diffs = new ArrayList<>();
        if (!Objects.equals(actual.getRetentionPolicy(), desired.getRetentionPolicy())) {
            diffs.add("retentionPolicy actual=" + actual.getRetentionPolicy()
                    + " expected=" + desired.getRetentionPolicy());
        }
        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType()
                    + " expected=" + desired.getStorageType());
        }
        if (!Objects.equals(actual.getMaxAge(), desired.getMaxAge())) {
            diffs.add("maxAge actual=" + actual.getMaxAge() + " expected=" + desired.getMaxAge());
        }
        if (!new HashSet<>(actual.getSubjects()).containsAll(desired.getSubjects())) {
            diffs.add("subjects actual=" + actual.getSubjects() + " expected=" + desired.getSubjects());
        }
        return diffs;
    }
}
