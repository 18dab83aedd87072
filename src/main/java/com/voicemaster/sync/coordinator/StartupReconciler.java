package com.voicemaster.sync.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.voicemaster.sync.core.outcome.Outcome;

/**
 * Runs {@link LifecycleCoordinator#reconcile()} once on startup, ahead of the stream bootstrap
 * runner that releases the event consumer, so rows left behind by a crash between platform delete
 * and row removal are pruned before events are consumed.
 *
 * A failed pass is logged and does not stop startup; the periodic sweep covers what it missed.
 */
@Component
@Order(StartupReconciler.ORDER)
@ConditionalOnProperty(prefix = "voicemaster.coordinator", name = "reconcile-on-startup", havingValue = "true", matchIfMissing = true)
public class StartupReconciler implements ApplicationRunner {

    /** Runner order; anything that starts event consumption must run after this. */
    public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    private static final Logger log = LoggerFactory.getLogger(StartupReconciler.class);

    private final LifecycleCoordinator coordinator;

    public StartupReconciler(LifecycleCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void run(ApplicationArguments args) {
        Outcome<ReconciliationReport> outcome = coordinator.reconcile();
        if (outcome.isSuccess()) {
            ReconciliationReport report = outcome.value();
            log.info("Startup reconciliation pruned={} tornDown={} failed={}",
                    report.pruned(), report.tornDown(), report.failed());
        } else {
            log.warn("Startup reconciliation failed: {} {}", outcome.failure(), outcome.detail());
        }
    }
}
