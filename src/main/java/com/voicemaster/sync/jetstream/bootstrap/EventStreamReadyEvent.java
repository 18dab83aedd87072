package com.voicemaster.sync.jetstream.bootstrap;

/**
 * Published by {@link EventStreamBootstrapper} once the member event stream exists and matches
 * the configured shape. The event consumer starts on it as well as on application ready, so it
 * does not depend on this node owning the stream.
 *
 * <p>No payload: presence means readiness.</p>
 */
public record EventStreamReadyEvent() {
}
