package com.voicemaster.sync.coordinator;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the lifecycle coordinator.
 *
 * <h2>Binding</h2>
 * Bound from Spring Boot config using the prefix {@code voicemaster.coordinator}, e.g.:
 * <pre>
 * voicemaster:
 *   coordinator:
 *     section-timeout: 5s
 *     creation-debounce: 10s
 *     max-user-limit: 99
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>{@code maxUserLimit} and {@code maxNameLength} mirror the chat platform's own limits and
 *       should only change when the platform changes them.</li>
 *   <li>{@code sectionTimeout} bounds how long a command or event waits behind another operation
 *       on the same channel or guild before failing with {@code BUSY}.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "voicemaster.coordinator")
public class CoordinatorProperties {

    /** Wait bound for entering a per-channel, per-member or per-guild section. */
    private Duration sectionTimeout = Duration.ofSeconds(5);

    /** Upper bound on a single store round-trip. */
    private Duration storeTimeout = Duration.ofSeconds(10);

    /**
     * Join events for a member who already owns a channel younger than this are treated as
     * redeliveries and ignored.
     */
    private Duration creationDebounce = Duration.ofSeconds(10);

    /** Size of the bounded worker pool running events and commands. */
    private int workers = 16;

    private int maxUserLimit = 99;

    private int maxNameLength = 100;

    private int auditLogDefault = 10;

    private int auditLogMax = 50;

    private boolean sweepEnabled = true;

    private Duration sweepInterval = Duration.ofSeconds(60);

    private boolean reconcileOnStartup = true;

    public Duration getSectionTimeout() { return sectionTimeout; }
    public void setSectionTimeout(Duration sectionTimeout) { this.sectionTimeout = sectionTimeout; }

    public Duration getStoreTimeout() { return storeTimeout; }
    public void setStoreTimeout(Duration storeTimeout) { this.storeTimeout = storeTimeout; }

    public Duration getCreationDebounce() { return creationDebounce; }
    public void setCreationDebounce(Duration creationDebounce) { this.creationDebounce = creationDebounce; }

    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }

    public int getMaxUserLimit() { return maxUserLimit; }
    public void setMaxUserLimit(int maxUserLimit) { this.maxUserLimit = maxUserLimit; }

    public int getMaxNameLength() { return maxNameLength; }
    public void setMaxNameLength(int maxNameLength) { this.maxNameLength = maxNameLength; }

    public int getAuditLogDefault() { return auditLogDefault; }
    public void setAuditLogDefault(int auditLogDefault) { this.auditLogDefault = auditLogDefault; }

    public int getAuditLogMax() { return auditLogMax; }
    public void setAuditLogMax(int auditLogMax) { this.auditLogMax = auditLogMax; }

    public boolean isSweepEnabled() { return sweepEnabled; }
    public void setSweepEnabled(boolean sweepEnabled) { this.sweepEnabled = sweepEnabled; }

    public Duration getSweepInterval() { return sweepInterval; }
    public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }

    public boolean isReconcileOnStartup() { return reconcileOnStartup; }
    public void setReconcileOnStartup(boolean reconcileOnStartup) { this.reconcileOnStartup = reconcileOnStartup; }
}
