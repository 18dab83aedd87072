package com.voicemaster.sync.jetstream.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Consumption of membership-change events from JetStream.
 *
 * <h2>Binding</h2>
 * Bound using the prefix {@code voicemaster.events}, e.g.:
 * <pre>
 * voicemaster:
 *   events:
 *     enabled: true
 *     stream: VOICE_EVENTS
 *     filter-subject: voicemaster.events.member-moved.&gt;
 *     durable: voicemaster-coordinator
 *     batch-size: 50
 *     poll-interval: 250ms
 *     redelivery-delay: 1s
 *     shards: 8
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>Events of one guild always land on the same shard, so they are handled in delivery
 *       order. Different shards are handled concurrently.</li>
 *   <li>{@code bootstrapStream} should only be enabled on the node that owns the stream.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "voicemaster.events")
public class MemberEventsProperties {

    private boolean enabled = true;

    /** Create the stream on startup if it does not exist. */
    private boolean bootstrapStream = false;

    private String stream = "VOICE_EVENTS";

    private String filterSubject = "voicemaster.events.member-moved.>";

    private String durable = "voicemaster-coordinator";

    private int batchSize = 50;

    private Duration pollInterval = Duration.ofMillis(250);

    /** How long the server waits before redelivering a transiently failed event. */
    private Duration redeliveryDelay = Duration.ofSeconds(1);

    /** Number of guild shards processed in parallel. */
    private int shards = 8;

    /** Retention of the stream when this node creates it. */
    private Duration maxAge = Duration.ofHours(1);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isBootstrapStream() { return bootstrapStream; }
    public void setBootstrapStream(boolean bootstrapStream) { this.bootstrapStream = bootstrapStream; }

    public String getStream() { return stream; }
    public void setStream(String stream) { this.stream = stream; }

    public String getFilterSubject() { return filterSubject; }
    public void setFilterSubject(String filterSubject) { this.filterSubject = filterSubject; }

    public String getDurable() { return durable; }
    public void setDurable(String durable) { this.durable = durable; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

    public Duration getRedeliveryDelay() { return redeliveryDelay; }
    public void setRedeliveryDelay(Duration redeliveryDelay) { this.redeliveryDelay = redeliveryDelay; }

    public int getShards() { return shards; }
    public void setShards(int shards) { this.shards = shards; }

    public Duration getMaxAge() { return maxAge; }
    public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }
}
