package com.enterprise.taskgateway.rpc;

import com.enterprise.taskgateway.exception.NotFoundException;
import com.enterprise.taskgateway.wire.Task;
import com.enterprise.taskgateway.wire.TaskDraft;
import com.enterprise.taskgateway.wire.TaskQuery;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Tasks service test double keeping records in insertion order.
 * While silent, every call is accepted and never answered. A latency delays
 * every answer without holding a thread.
 */
public class InMemoryTasksService extends TasksServiceBinding {

    private final Map<UUID, Task> tasks = new LinkedHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean silent;
    private volatile Duration latency = Duration.ZERO;

    public void setSilent(boolean silent) {
        this.silent = silent;
    }

    public void setLatency(Duration latency) {
        this.latency = latency;
    }

    public int getCalls() {
        return calls.get();
    }

    public synchronized int size() {
        return tasks.size();
    }

    @Override
    protected CompletableFuture<Task> create(TaskDraft draft) {
        if (begin()) {
            return new CompletableFuture<>();
        }
        Task task = draft.toTask(UUID.randomUUID(), Instant.now());
        synchronized (this) {
            tasks.put(task.getId(), task);
        }
        return reply(CompletableFuture.completedFuture(task));
    }

    @Override
    protected CompletableFuture<Task> getById(UUID id) {
        if (begin()) {
            return new CompletableFuture<>();
        }
        Task task;
        synchronized (this) {
            task = tasks.get(id);
        }
        return task != null
            ? reply(CompletableFuture.completedFuture(task))
            : reply(CompletableFuture.failedFuture(new NotFoundException(id.toString())));
    }

    @Override
    protected CompletableFuture<List<Task>> list(TaskQuery query) {
        if (begin()) {
            return new CompletableFuture<>();
        }
        List<Task> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(tasks.values());
        }
        return reply(CompletableFuture.completedFuture(snapshot.stream()
            .filter(query::matches)
            .skip(query.getOffset())
            .limit(query.getLimit())
            .collect(Collectors.toList())));
    }

    @Override
    protected CompletableFuture<Task> updateById(Task task) {
        if (begin()) {
            return new CompletableFuture<>();
        }
        synchronized (this) {
            if (!tasks.containsKey(task.getId())) {
                return reply(CompletableFuture.failedFuture(new NotFoundException(task.getId().toString())));
            }
            tasks.put(task.getId(), task);
        }
        return reply(CompletableFuture.completedFuture(task));
    }

    @Override
    protected CompletableFuture<Void> deleteById(UUID id) {
        if (begin()) {
            return new CompletableFuture<>();
        }
        synchronized (this) {
            if (tasks.remove(id) == null) {
                return reply(CompletableFuture.failedFuture(new NotFoundException(id.toString())));
            }
        }
        return reply(CompletableFuture.completedFuture(null));
    }

    private <T> CompletableFuture<T> reply(CompletableFuture<T> answer) {
        long delayMs = latency.toMillis();
        if (delayMs <= 0) {
            return answer;
        }
        CompletableFuture<T> delayed = new CompletableFuture<>();
        CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS).execute(() -> answer.whenComplete((value, error) -> {
            if (error != null) {
                delayed.completeExceptionally(error);
            } else {
                delayed.complete(value);
            }
        }));
        return delayed;
    }

    private boolean begin() {
        calls.incrementAndGet();
        return silent;
    }
}
