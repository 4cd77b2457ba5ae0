package com.enterprise.taskgateway.rpc;

import com.enterprise.taskgateway.exception.GatewayException;
import com.enterprise.taskgateway.wire.Empty;
import com.enterprise.taskgateway.wire.Task;
import com.enterprise.taskgateway.wire.TaskDraft;
import com.enterprise.taskgateway.wire.TaskQuery;
import com.enterprise.taskgateway.wire.TaskWireCodec;
import io.grpc.BindableService;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base class for a tasks service served over the task wire codec. Subclasses
 * implement the six operations; failures completed with a
 * {@link GatewayException} are sent back with the matching status code.
 * List responses are gzip-compressed.
 */
public abstract class TasksServiceBinding implements BindableService {

    private static final Logger logger = LoggerFactory.getLogger(TasksServiceBinding.class);

    private final TaskServiceMethods methods;

    protected TasksServiceBinding() {
        this(new TaskWireCodec());
    }

    protected TasksServiceBinding(TaskWireCodec codec) {
        this.methods = new TaskServiceMethods(codec);
    }

    protected abstract CompletableFuture<Task> create(TaskDraft draft);

    protected abstract CompletableFuture<Task> getById(UUID id);

    protected abstract CompletableFuture<List<Task>> list(TaskQuery query);

    protected abstract CompletableFuture<Task> updateById(Task task);

    protected abstract CompletableFuture<Void> deleteById(UUID id);

    /**
     * Emit matching tasks one by one. The default streams the result of
     * {@link #list(TaskQuery)} and stops early when the caller cancels.
     */
    protected void listStream(TaskQuery query, ServerCallStreamObserver<Task> observer) {
        list(query).whenComplete((tasks, error) -> {
            if (error != null) {
                observer.onError(toStatus(error).asRuntimeException());
                return;
            }
            for (Task task : tasks) {
                if (observer.isCancelled()) {
                    logger.debug("ListStream cancelled by client");
                    return;
                }
                observer.onNext(task);
            }
            observer.onCompleted();
        });
    }

    @Override
    public ServerServiceDefinition bindService() {
        return ServerServiceDefinition.builder(TaskServiceMethods.SERVICE_NAME)
            .addMethod(methods.create(), ServerCalls.asyncUnaryCall(
                (TaskDraft draft, StreamObserver<Task> observer) -> reply(create(draft), observer, false)))
            .addMethod(methods.getById(), ServerCalls.asyncUnaryCall(
                (UUID id, StreamObserver<Task> observer) -> reply(getById(id), observer, false)))
            .addMethod(methods.list(), ServerCalls.asyncUnaryCall(
                (TaskQuery query, StreamObserver<List<Task>> observer) -> reply(list(query), observer, true)))
            .addMethod(methods.listStream(), ServerCalls.asyncServerStreamingCall(
                (TaskQuery query, StreamObserver<Task> observer) -> {
                    ServerCallStreamObserver<Task> serverObserver = (ServerCallStreamObserver<Task>) observer;
                    serverObserver.setOnCancelHandler(() -> logger.debug("ListStream call cancelled"));
                    serverObserver.setCompression(TasksRpcClient.GZIP);
                    listStream(query, serverObserver);
                }))
            .addMethod(methods.updateById(), ServerCalls.asyncUnaryCall(
                (Task task, StreamObserver<Task> observer) -> reply(updateById(task), observer, false)))
            .addMethod(methods.deleteById(), ServerCalls.asyncUnaryCall(
                (UUID id, StreamObserver<Empty> observer) ->
                    reply(deleteById(id).thenApply(ignored -> Empty.INSTANCE), observer, false)))
            .build();
    }

    private <T> void reply(CompletableFuture<T> future, StreamObserver<T> observer, boolean compress) {
        if (compress) {
            ((ServerCallStreamObserver<T>) observer).setCompression(TasksRpcClient.GZIP);
        }
        future.whenComplete((value, error) -> {
            if (error != null) {
                observer.onError(toStatus(error).asRuntimeException());
            } else {
                observer.onNext(value);
                observer.onCompleted();
            }
        });
    }

    /**
     * Status sent to the client for a failed operation
     */
    static Status toStatus(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
               && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof StatusRuntimeException) {
            return ((StatusRuntimeException) cause).getStatus();
        }
        if (cause instanceof GatewayException) {
            GatewayException gatewayError = (GatewayException) cause;
            Status status;
            switch (gatewayError.getKind()) {
                case NOT_FOUND:
                    status = Status.NOT_FOUND;
                    break;
                case INVALID_ARGUMENT:
                case ENCODING_ERROR:
                case DECODING_ERROR:
                    status = Status.INVALID_ARGUMENT;
                    break;
                case UNAVAILABLE:
                case TRANSPORT_ERROR:
                    status = Status.UNAVAILABLE;
                    break;
                case DEADLINE_EXCEEDED:
                    status = Status.DEADLINE_EXCEEDED;
                    break;
                default:
                    status = Status.INTERNAL;
                    break;
            }
            return status.withDescription(gatewayError.getMessage());
        }
        logger.error("Tasks service operation failed", cause);
        return Status.INTERNAL.withDescription(String.valueOf(cause.getMessage()));
    }
}
