package com.tasksync.shared.eventstore;

import com.tasksync.shared.errors.VersionConflictException;
import com.tasksync.shared.events.TaskEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Heap-backed event store for tests and local runs.
 *
 * The conditional append runs inside {@link ConcurrentHashMap#compute}, which serializes
 * writers of the same (tenant, task) key while leaving other keys uncontended.
 */
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final Map<String, List<TaskEvent>> streams = new ConcurrentHashMap<>();
    private final Map<String, List<TaskEvent>> tenantLogs = new ConcurrentHashMap<>();
    private final List<Consumer<AppendResult>> subscribers = new ArrayList<>();

    /** Registers an in-process change-feed subscriber, invoked after each successful append. */
    public synchronized void subscribe(Consumer<AppendResult> subscriber) {
        subscribers.add(subscriber);
    }

    @Override
    public AppendResult append(String tenantId, String taskId, long expectedVersion, List<TaskEvent> events) {
        AppendValidator.validate(tenantId, taskId, expectedVersion, events);

        AtomicReference<AppendResult> result = new AtomicReference<>();
        streams.compute(key(tenantId, taskId), (key, existing) -> {
            long current = existing == null ? 0 : existing.size();
            if (current != expectedVersion) {
                throw new VersionConflictException(tenantId, taskId, expectedVersion, current);
            }
            if (existing != null && !existing.isEmpty()) {
                AppendValidator.requireAfter(tenantId, taskId, current,
                        existing.get(existing.size() - 1).getEventId(), events);
            }
            List<TaskEvent> next = new ArrayList<>(existing == null ? List.of() : existing);
            next.addAll(events);
            List<TaskEvent> tenantLog = tenantLogs.computeIfAbsent(tenantId,
                    t -> Collections.synchronizedList(new ArrayList<>()));
            tenantLog.addAll(events);
            result.set(new AppendResult(tenantId, taskId, next.size(), List.copyOf(events)));
            return Collections.unmodifiableList(next);
        });

        log.debug("Events appended: tenantId={}, taskId={}, count={}, version={}",
                tenantId, taskId, events.size(), result.get().getNewVersion());
        List<Consumer<AppendResult>> current;
        synchronized (this) {
            current = List.copyOf(subscribers);
        }
        current.forEach(s -> s.accept(result.get()));
        return result.get();
    }

    @Override
    public List<TaskEvent> read(String tenantId, String taskId) {
        return streams.getOrDefault(key(tenantId, taskId), List.of());
    }

    @Override
    public List<TaskEvent> readSince(String tenantId, String taskId, String afterEventId) {
        List<TaskEvent> stream = read(tenantId, taskId);
        for (int i = 0; i < stream.size(); i++) {
            if (stream.get(i).getEventId().equals(afterEventId)) {
                return List.copyOf(stream.subList(i + 1, stream.size()));
            }
        }
        throw new CutoffNotFoundException(taskId, afterEventId);
    }

    @Override
    public List<TaskEvent> readTenant(String tenantId) {
        List<TaskEvent> tenantLog = tenantLogs.get(tenantId);
        if (tenantLog == null) {
            return List.of();
        }
        synchronized (tenantLog) {
            return List.copyOf(tenantLog);
        }
    }

    @Override
    public long currentVersion(String tenantId, String taskId) {
        return read(tenantId, taskId).size();
    }

    private static String key(String tenantId, String taskId) {
        return tenantId + "#" + taskId;
    }
}
