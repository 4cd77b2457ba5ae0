package com.enterprise.taskgateway.rpc;

import com.enterprise.taskgateway.exception.GatewayException;
import com.enterprise.taskgateway.transport.HandleLease;
import com.enterprise.taskgateway.wire.Task;
import io.grpc.ClientCall;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * A single-use ListStream call. Tasks reach the observer in emission order;
 * after {@link #cancel()} nothing more is delivered and the lease is released.
 */
public class TaskStream {

    private static final Logger logger = LoggerFactory.getLogger(TaskStream.class);

    private final HandleLease lease;
    private final StreamObserver<Task> observer;
    private final Function<Throwable, GatewayException> failureMapper;
    private final Runnable onSuccess;
    private final CompletableFuture<Long> completion = new CompletableFuture<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicLong delivered = new AtomicLong();
    private volatile ClientCall<?, ?> call;

    TaskStream(HandleLease lease, StreamObserver<Task> observer,
               Function<Throwable, GatewayException> failureMapper, Runnable onSuccess) {
        this.lease = lease;
        this.observer = observer;
        this.failureMapper = failureMapper;
        this.onSuccess = onSuccess;
        completion.whenComplete((count, error) -> {
            if (error instanceof CancellationException) {
                cancel();
            }
        });
    }

    /**
     * A stream that failed before its call could start
     */
    static TaskStream failed(StreamObserver<Task> observer, GatewayException error) {
        TaskStream stream = new TaskStream(null, observer, t -> error, () -> { });
        stream.finished.set(true);
        observer.onError(error);
        stream.completion.completeExceptionally(error);
        return stream;
    }

    void attach(ClientCall<?, ?> call) {
        this.call = call;
        if (cancelled.get()) {
            call.cancel("Cancelled by caller", null);
        }
    }

    /**
     * Stop delivery and release the lease. Safe to call from inside the observer.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        ClientCall<?, ?> current = call;
        if (current != null) {
            current.cancel("Cancelled by caller", null);
        }
        if (finished.compareAndSet(false, true)) {
            lease.close();
            completion.cancel(false);
            logger.debug("ListStream cancelled after {} task(s)", delivered.get());
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Number of tasks handed to the observer so far
     */
    public long getDelivered() {
        return delivered.get();
    }

    /**
     * Completes with the delivered count, exceptionally with a {@link GatewayException},
     * or is cancelled. Cancelling it cancels the stream.
     */
    public CompletableFuture<Long> completion() {
        return completion;
    }

    StreamObserver<Task> responseObserver() {
        return new StreamObserver<>() {
            @Override
            public void onNext(Task task) {
                if (cancelled.get()) {
                    return;
                }
                delivered.incrementAndGet();
                observer.onNext(task);
            }

            @Override
            public void onError(Throwable t) {
                if (cancelled.get() || !finished.compareAndSet(false, true)) {
                    return;
                }
                GatewayException error = failureMapper.apply(t);
                lease.close();
                observer.onError(error);
                completion.completeExceptionally(error);
            }

            @Override
            public void onCompleted() {
                if (cancelled.get() || !finished.compareAndSet(false, true)) {
                    return;
                }
                onSuccess.run();
                lease.close();
                observer.onCompleted();
                completion.complete(delivered.get());
            }
        };
    }
}
