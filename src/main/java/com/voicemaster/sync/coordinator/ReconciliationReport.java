package com.voicemaster.sync.coordinator;

/**
 * Totals of one reconciliation pass.
 *
 * @param pruned   rows removed because the platform no longer has the channel
 * @param tornDown empty tracked channels deleted because the guild asks for startup cleanup
 * @param failed   rows whose reconciliation returned a failure outcome
 */
public record ReconciliationReport(int pruned, int tornDown, int failed) {
}
