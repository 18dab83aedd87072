package com.voicemaster.sync.coordinator;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires the coordinator's clock and its bounded worker pool.
 *
 * <p>Coordinator operations block on platform and store calls, so they run on
 * {@code coordinatorWorkers} (never on a Netty event loop). The pool size caps how many events
 * and commands are handled at once.</p>
 */
@Configuration
@EnableConfigurationProperties(CoordinatorProperties.class)
public class CoordinatorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler coordinatorWorkers(CoordinatorProperties props) {
        return Schedulers.newBoundedElastic(props.getWorkers(), 10_000, "coordinator");
    }
}
