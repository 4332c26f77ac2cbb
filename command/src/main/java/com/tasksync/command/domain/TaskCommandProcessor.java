package com.tasksync.command.domain;

import com.tasksync.command.config.CommandProperties;
import com.tasksync.command.domain.TaskCommands.*;
import com.tasksync.command.idempotency.CommandIdempotencyStore;
import com.tasksync.command.idempotency.IdempotencyClaim;
import com.tasksync.shared.domain.TaskAggregateLoader;
import com.tasksync.shared.domain.TaskAggregateReconstructor;
import com.tasksync.shared.domain.TaskState;
import com.tasksync.shared.errors.ConcurrencyConflictException;
import com.tasksync.shared.errors.TaskNotFoundException;
import com.tasksync.shared.errors.TransientInfrastructureException;
import com.tasksync.shared.errors.ValidationException;
import com.tasksync.shared.errors.VersionConflictException;
import com.tasksync.shared.eventstore.AppendResult;
import com.tasksync.shared.eventstore.EventStore;
import com.tasksync.shared.events.EventIds;
import com.tasksync.shared.events.EventMetadata;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.events.TaskEvents;
import com.tasksync.shared.security.RequestContext;
import com.tasksync.shared.security.TenantMembershipChecker;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Task command handling: authorize, validate, then load → decide → append under the
 * optimistic version check.
 *
 * On a version conflict the whole cycle runs again from a fresh load, so the decision is
 * re-made against the state that won. Attempts are bounded and separated by jittered
 * exponential backoff; when they run out the caller gets a concurrency conflict instead of
 * an unbounded wait.
 */
@Slf4j
@Service
public class TaskCommandProcessor {

    private final TaskAggregateLoader loader;
    private final TaskAggregateReconstructor reconstructor;
    private final EventStore eventStore;
    private final CommandValidator validator;
    private final TenantMembershipChecker membershipChecker;
    private final CommandIdempotencyStore idempotencyStore;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final Counter conflictCounter;
    private final Counter retryCounter;

    public TaskCommandProcessor(TaskAggregateLoader loader,
                                TaskAggregateReconstructor reconstructor,
                                EventStore eventStore,
                                CommandValidator validator,
                                TenantMembershipChecker membershipChecker,
                                CommandIdempotencyStore idempotencyStore,
                                Clock clock,
                                MeterRegistry meterRegistry,
                                CommandProperties properties) {
        this.loader = loader;
        this.reconstructor = reconstructor;
        this.eventStore = eventStore;
        this.validator = validator;
        this.membershipChecker = membershipChecker;
        this.idempotencyStore = idempotencyStore;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = Math.max(1, properties.getMaxAttempts());
        this.backoff = IntervalFunction.ofExponentialRandomBackoff(
                properties.getInitialBackoff(),
                properties.getBackoffMultiplier(),
                properties.getRandomizationFactor());
        this.conflictCounter = Counter.builder("tasks.commands.conflicts")
                .description("Version conflicts observed while appending task events")
                .register(meterRegistry);
        this.retryCounter = Counter.builder("tasks.commands.retries")
                .description("Command cycles re-run after a conflict or transient failure")
                .register(meterRegistry);
    }

    public CommandResult handle(TaskCommand command) {
        RequestContext ctx = command.getContext();
        membershipChecker.checkMember(ctx);

        String idempotencyKey = ctx.getIdempotencyKey();
        if (idempotencyKey != null) {
            IdempotencyClaim claim = idempotencyStore.claim(ctx.getTenantId(), idempotencyKey);
            switch (claim.getStatus()) {
                case COMPLETED -> {
                    CommandResult stored = claim.getResult();
                    if (!sameRequest(stored, command)) {
                        count(command, "rejected");
                        throw new ValidationException("Idempotency key " + idempotencyKey
                                + " was already used for " + stored.getType().name().toLowerCase()
                                + " of task " + stored.getTaskId());
                    }
                    count(command, "replayed");
                    log.info("Command replayed from idempotency key: type={}, key={}, taskId={}",
                            command.getType(), idempotencyKey, stored.getTaskId());
                    return stored.withReplayed(true);
                }
                case IN_PROGRESS -> {
                    count(command, "in_progress");
                    throw new ConcurrencyConflictException(command.getTaskId(),
                            "A request with idempotency key " + idempotencyKey + " is still in progress");
                }
                case CLAIMED -> {
                    // proceed
                }
            }
        }

        CommandResult result;
        try {
            TaskCommand valid = validator.validate(command);
            String taskId = valid.getType() == CommandType.CREATE ? EventIds.next() : valid.getTaskId();
            result = executeWithRetry(valid, taskId);
        } catch (RuntimeException ex) {
            count(command, "rejected");
            if (idempotencyKey != null) {
                idempotencyStore.release(ctx.getTenantId(), idempotencyKey);
            }
            throw ex;
        }

        if (idempotencyKey != null) {
            try {
                idempotencyStore.complete(ctx.getTenantId(), idempotencyKey, result);
            } catch (RuntimeException ex) {
                // the events are appended: the key stays pending until it expires so a retry
                // with the same key cannot append them again
                log.warn("Idempotency result not stored, key left pending: key={}, taskId={}, error={}",
                        idempotencyKey, result.getTaskId(), ex.getMessage());
            }
        }
        count(command, result.getEventIds().isEmpty() ? "noop" : "accepted");
        return result;
    }

    /** A stored result answers only the request that produced it: same type, same task. */
    private static boolean sameRequest(CommandResult stored, TaskCommand command) {
        if (stored.getType() != command.getType()) {
            return false;
        }
        return command.getType() == CommandType.CREATE || Objects.equals(stored.getTaskId(), command.getTaskId());
    }

    // ─── Retry loop ───────────────────────────────────────────────────────────

    private CommandResult executeWithRetry(TaskCommand command, String taskId) {
        for (int attempt = 1; ; attempt++) {
            try {
                return execute(command, taskId);
            } catch (VersionConflictException ex) {
                conflictCounter.increment();
                if (attempt >= maxAttempts) {
                    log.warn("Giving up after version conflicts: type={}, taskId={}, attempts={}",
                            command.getType(), taskId, attempt);
                    throw new ConcurrencyConflictException(taskId, attempt, ex);
                }
                log.info("Version conflict, reloading: type={}, taskId={}, attempt={}, expected={}, actual={}",
                        command.getType(), taskId, attempt, ex.getExpectedVersion(), ex.getActualVersion());
            } catch (TransientInfrastructureException ex) {
                if (attempt >= maxAttempts) {
                    throw ex;
                }
                log.warn("Transient failure, retrying: type={}, taskId={}, attempt={}, error={}",
                        command.getType(), taskId, attempt, ex.getMessage());
            }
            retryCounter.increment();
            pause(backoff.apply(attempt));
        }
    }

    private void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfrastructureException("Interrupted during command retry backoff", e);
        }
    }

    // ─── One load / decide / append cycle ─────────────────────────────────────

    private CommandResult execute(TaskCommand command, String taskId) {
        RequestContext ctx = command.getContext();
        Optional<TaskState> current = loader.load(ctx.getTenantId(), taskId);
        List<TaskEvent> events = decide(command, taskId, current);
        long expectedVersion = current.map(TaskState::getVersion).orElse(0L);

        if (events.isEmpty()) {
            TaskState state = current.orElseThrow();
            log.debug("Command is a no-op: type={}, taskId={}, version={}", command.getType(), taskId, expectedVersion);
            return CommandResult.builder()
                    .taskId(taskId)
                    .type(command.getType())
                    .version(state.getVersion())
                    .eventIds(List.of())
                    .state(state)
                    .build();
        }

        AppendResult appended = eventStore.append(ctx.getTenantId(), taskId, expectedVersion, events);
        TaskState next = reconstructor.reconstruct(appended.getEvents(), current.orElse(null)).orElseThrow();

        log.info("Command accepted: type={}, tenantId={}, taskId={}, version={}, events={}",
                command.getType(), ctx.getTenantId(), taskId, appended.getNewVersion(), events.size());
        return CommandResult.builder()
                .taskId(taskId)
                .type(command.getType())
                .version(appended.getNewVersion())
                .eventIds(events.stream().map(TaskEvent::getEventId).toList())
                .state(next)
                .build();
    }

    private List<TaskEvent> decide(TaskCommand command, String taskId, Optional<TaskState> current) {
        if (command.getType() == CommandType.CREATE) {
            CreateTask create = (CreateTask) command;
            String assignee = create.getAssigneeId() != null ? create.getAssigneeId() : create.getContext().getUserId();
            return List.of(
                    new TaskEvents.TaskCreated(metadata(command, taskId, null), create.getTitle(),
                            create.getDescription(), create.getTags()),
                    new TaskEvents.TaskAssigned(metadata(command, taskId, null), assignee));
        }

        TaskState state = current
                .filter(s -> !s.isDeleted())
                .orElseThrow(() -> new TaskNotFoundException(command.getContext().getTenantId(), taskId));
        String after = state.getLastEventId();

        return switch (command.getType()) {
            case UPDATE -> {
                requireActive(state);
                UpdateTask update = (UpdateTask) command;
                String title = changed(update.getTitle(), state.getTitle());
                String description = update.getDescription() == null ? null
                        : changed(update.getDescription(), Objects.toString(state.getDescription(), ""));
                List<String> tags = update.getTags() != null && !update.getTags().equals(state.getTags())
                        ? update.getTags() : null;
                if (title == null && description == null && tags == null) {
                    yield List.of();
                }
                yield List.of(new TaskEvents.TaskUpdated(metadata(command, taskId, after), title, description, tags));
            }
            case ASSIGN -> {
                requireActive(state);
                String assignee = ((AssignTask) command).getAssigneeId();
                yield assignee.equals(state.getAssigneeId()) ? List.of()
                        : List.of(new TaskEvents.TaskAssigned(metadata(command, taskId, after), assignee));
            }
            case COMPLETE -> state.isCompleted() ? List.of()
                    : List.of(new TaskEvents.TaskCompleted(metadata(command, taskId, after)));
            case REOPEN -> state.isActive() ? List.of()
                    : List.of(new TaskEvents.TaskReopened(metadata(command, taskId, after)));
            case DELETE -> List.of(new TaskEvents.TaskDeleted(metadata(command, taskId, after),
                    ((DeleteTask) command).getReason()));
            case CREATE -> throw new IllegalStateException("handled above");
        };
    }

    private static void requireActive(TaskState state) {
        if (!state.isActive()) {
            throw new ValidationException("Task " + state.getTaskId() + " is completed; reopen it before editing");
        }
    }

    /** The new value when it differs from the current one, else null. */
    private static String changed(String requested, String currentValue) {
        return requested != null && !requested.equals(currentValue) ? requested : null;
    }

    /** Event ids of a stream must keep increasing, even past a stored id minted by a faster clock. */
    private EventMetadata metadata(TaskCommand command, String taskId, String afterEventId) {
        RequestContext ctx = command.getContext();
        return EventMetadata.builder()
                .eventId(EventIds.nextAfter(afterEventId))
                .tenantId(ctx.getTenantId())
                .taskId(taskId)
                .actorId(ctx.getUserId())
                .occurredAt(clock.instant())
                .correlationId(ctx.getCorrelationId())
                .build();
    }

    private void count(TaskCommand command, String outcome) {
        Counter.builder("tasks.commands")
                .tag("type", command.getType().name().toLowerCase())
                .tag("outcome", outcome)
                .description("Task commands handled, by type and outcome")
                .register(meterRegistry)
                .increment();
    }
}
