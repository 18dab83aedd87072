package com.voicemaster.sync.command;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.voicemaster.sync.core.outcome.FailureKind;
import com.voicemaster.sync.core.outcome.Outcome;

import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

/**
 * HTTP surface for the external command router.
 *
 * <p>Example:</p>
 * <pre>
 * POST /api/guilds/42/commands
 * {"type":"limit","actorId":7,"limit":5}
 * </pre>
 */
@RestController
@RequestMapping("/api/guilds/{guildId}/commands")
public class CommandController {

    private final CommandDispatcher dispatcher;

    public CommandController(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping
    public Mono<ResponseEntity<Outcome<?>>> execute(@PathVariable long guildId,
                                                    @Valid @RequestBody GuildCommand command) {
        return dispatcher.dispatch(guildId, command)
                .map(outcome -> ResponseEntity.status(statusOf(outcome)).body(outcome));
    }

    static HttpStatus statusOf(Outcome<?> outcome) {
        if (outcome.isSuccess()) {
            return HttpStatus.OK;
        }
        return statusOf(outcome.failure());
    }

    static HttpStatus statusOf(FailureKind kind) {
        return switch (kind) {
            case INVALID_VALUE, INVALID_CONFIGURATION -> HttpStatus.BAD_REQUEST;
            case NOT_OWNER, NOT_PRESENT, FORBIDDEN -> HttpStatus.FORBIDDEN;
            case NOT_TRACKED, NOT_CONFIGURED -> HttpStatus.NOT_FOUND;
            case NOT_OWNERLESS, BUSY -> HttpStatus.CONFLICT;
            case PLATFORM_UNAVAILABLE, STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
