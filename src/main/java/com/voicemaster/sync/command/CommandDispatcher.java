package com.voicemaster.sync.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.voicemaster.sync.coordinator.GuildSetupService;
import com.voicemaster.sync.coordinator.LifecycleCoordinator;
import com.voicemaster.sync.core.outcome.Outcome;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Single typed entry point for commands. Each command maps to exactly one coordinator or setup
 * operation, executed on the coordinator worker pool.
 */
@Service
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final LifecycleCoordinator coordinator;
    private final GuildSetupService setup;
    private final Scheduler workers;

    public CommandDispatcher(LifecycleCoordinator coordinator, GuildSetupService setup, Scheduler coordinatorWorkers) {
        this.coordinator = coordinator;
        this.setup = setup;
        this.workers = coordinatorWorkers;
    }

    public Mono<Outcome<?>> dispatch(long guildId, GuildCommand command) {
        return Mono.<Outcome<?>>fromCallable(() -> execute(guildId, command))
                .subscribeOn(workers)
                .doOnNext(outcome -> {
                    if (!outcome.isSuccess()) {
                        log.debug("Command {} in guild={} by actor={} failed: {} {}",
                                command.getClass().getSimpleName(), guildId, command.actorId(),
                                outcome.failure(), outcome.detail());
                    }
                });
    }

    Outcome<?> execute(long guildId, GuildCommand command) {
        long actor = command.actorId();
        if (command instanceof GuildCommand.Setup c) {
            return setup.setup(guildId, actor, c.categoryName(), c.incubatorName());
        }
        if (command instanceof GuildCommand.EditRename c) {
            return setup.editRename(guildId, actor, c.target(), c.name());
        }
        if (command instanceof GuildCommand.EditSelect c) {
            return setup.editSelect(guildId, actor, c.incubatorChannelId(), c.categoryId());
        }
        if (command instanceof GuildCommand.EditDefaults c) {
            return setup.editDefaults(guildId, actor, c.nameTemplate(), c.userLimit());
        }
        if (command instanceof GuildCommand.EditCleanup c) {
            return setup.editCleanup(guildId, actor, c.enabled());
        }
        if (command instanceof GuildCommand.EditDisable) {
            return setup.editDisable(guildId, actor);
        }
        if (command instanceof GuildCommand.Name c) {
            return coordinator.setName(guildId, actor, c.name());
        }
        if (command instanceof GuildCommand.Limit c) {
            return coordinator.setLimit(guildId, actor, c.limit());
        }
        if (command instanceof GuildCommand.Lock c) {
            return coordinator.lock(guildId, c.channelId(), actor);
        }
        if (command instanceof GuildCommand.Unlock c) {
            return coordinator.unlock(guildId, c.channelId(), actor);
        }
        if (command instanceof GuildCommand.Permit c) {
            return coordinator.permit(guildId, c.channelId(), actor, c.userId());
        }
        if (command instanceof GuildCommand.Claim c) {
            return coordinator.claim(guildId, c.channelId(), actor);
        }
        if (command instanceof GuildCommand.ListChannels) {
            return coordinator.list(guildId, actor);
        }
        if (command instanceof GuildCommand.AuditLogQuery c) {
            return coordinator.recentAudit(guildId, c.count());
        }
        throw new IllegalArgumentException("Unsupported command " + command.getClass().getName());
    }
}
