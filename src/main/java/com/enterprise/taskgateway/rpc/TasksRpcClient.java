package com.enterprise.taskgateway.rpc;

import com.enterprise.taskgateway.config.GatewayConfig;
import com.enterprise.taskgateway.exception.DeadlineExceededException;
import com.enterprise.taskgateway.exception.DecodingException;
import com.enterprise.taskgateway.exception.EncodingException;
import com.enterprise.taskgateway.exception.GatewayException;
import com.enterprise.taskgateway.exception.InternalException;
import com.enterprise.taskgateway.exception.InvalidArgumentException;
import com.enterprise.taskgateway.exception.NotFoundException;
import com.enterprise.taskgateway.exception.TransportException;
import com.enterprise.taskgateway.exception.UnavailableException;
import com.enterprise.taskgateway.transport.ConnectionPool;
import com.enterprise.taskgateway.transport.HandleLease;
import com.enterprise.taskgateway.transport.PooledHandle;
import com.enterprise.taskgateway.wire.Empty;
import com.enterprise.taskgateway.wire.Task;
import com.enterprise.taskgateway.wire.TaskDraft;
import com.enterprise.taskgateway.wire.TaskQuery;
import com.enterprise.taskgateway.wire.TaskWireCodec;
import com.enterprise.taskgateway.wire.WireFormat;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientInterceptors;
import io.grpc.ClientCall;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Asynchronous client for the tasks service over pooled, multiplexed handles.
 *
 * <p>Every unary call returns a future that completes with exactly one result
 * or one {@link GatewayException}: {@link NotFoundException},
 * {@link InvalidArgumentException}, {@link UnavailableException} (a
 * {@link TransportException} when the handle was retired under the call),
 * {@link DeadlineExceededException}, or {@link InternalException}. A corrupt
 * response surfaces as the {@link DecodingException} itself. The client never
 * retries.
 */
public class TasksRpcClient {

    private static final Logger logger = LoggerFactory.getLogger(TasksRpcClient.class);

    public static final String GZIP = "gzip";

    private final ConnectionPool pool;
    private final TaskWireCodec codec;
    private final GatewayConfig.ClientConfig config;
    private final RequestIdInterceptor requestIdInterceptor = new RequestIdInterceptor();

    private final MethodDescriptor<byte[], Task> createMethod;
    private final MethodDescriptor<byte[], Task> getByIdMethod;
    private final MethodDescriptor<byte[], List<Task>> listMethod;
    private final MethodDescriptor<byte[], Task> listStreamMethod;
    private final MethodDescriptor<byte[], Task> updateByIdMethod;
    private final MethodDescriptor<byte[], Empty> deleteByIdMethod;

    public TasksRpcClient(ConnectionPool pool, TaskWireCodec codec, GatewayConfig.ClientConfig config) {
        this.pool = pool;
        this.codec = codec;
        this.config = config;

        TaskServiceMethods methods = new TaskServiceMethods(codec);
        this.createMethod = TaskServiceMethods.preEncoded(methods.create());
        this.getByIdMethod = TaskServiceMethods.preEncoded(methods.getById());
        this.listMethod = TaskServiceMethods.preEncoded(methods.list());
        this.listStreamMethod = TaskServiceMethods.preEncoded(methods.listStream());
        this.updateByIdMethod = TaskServiceMethods.preEncoded(methods.updateById());
        this.deleteByIdMethod = TaskServiceMethods.preEncoded(methods.deleteById());
    }

    public CompletableFuture<Task> create(TaskDraft draft) {
        return create(draft, RpcCallOptions.defaults());
    }

    public CompletableFuture<Task> create(TaskDraft draft, RpcCallOptions options) {
        return unary(createMethod, TaskWireCodec.TASK_DRAFT, draft, options, false, null);
    }

    public CompletableFuture<Task> getById(UUID id) {
        return getById(id, RpcCallOptions.defaults());
    }

    public CompletableFuture<Task> getById(UUID id, RpcCallOptions options) {
        return unary(getByIdMethod, TaskWireCodec.TASK_ID, id, options, false, String.valueOf(id));
    }

    public CompletableFuture<List<Task>> list(TaskQuery query) {
        return list(query, RpcCallOptions.defaults());
    }

    /**
     * Fetch at most {@code query.getLimit()} matching tasks in one response
     */
    public CompletableFuture<List<Task>> list(TaskQuery query, RpcCallOptions options) {
        return unary(listMethod, TaskWireCodec.TASK_QUERY, query, options, true, null);
    }

    public CompletableFuture<Task> updateById(Task task) {
        return updateById(task, RpcCallOptions.defaults());
    }

    /**
     * Replace the stored record with the given full snapshot
     */
    public CompletableFuture<Task> updateById(Task task, RpcCallOptions options) {
        String resourceId = task != null ? String.valueOf(task.getId()) : null;
        return unary(updateByIdMethod, TaskWireCodec.TASK, task, options, false, resourceId);
    }

    public CompletableFuture<Void> deleteById(UUID id) {
        return deleteById(id, RpcCallOptions.defaults());
    }

    public CompletableFuture<Void> deleteById(UUID id, RpcCallOptions options) {
        return unary(deleteByIdMethod, TaskWireCodec.TASK_ID, id, options, false, String.valueOf(id))
            .thenApply(empty -> null);
    }

    public TaskStream listStream(TaskQuery query, StreamObserver<Task> observer) {
        return listStream(query, observer, RpcCallOptions.defaults());
    }

    /**
     * Start a server-streaming list. Failures before the call starts are
     * delivered through the observer and the stream's completion future.
     */
    public TaskStream listStream(TaskQuery query, StreamObserver<Task> observer, RpcCallOptions options) {
        byte[] payload;
        HandleLease lease;
        try {
            payload = encodeRequest(TaskWireCodec.TASK_QUERY, query);
            lease = pool.acquire();
        } catch (GatewayException e) {
            return TaskStream.failed(observer, e);
        }

        PooledHandle handle = lease.handle();
        TaskStream stream = new TaskStream(lease, observer,
            t -> toGatewayException(t, handle, null), () -> pool.reportSuccess(handle));

        ClientCall<byte[], Task> call = channel(lease).newCall(listStreamMethod, callOptions(options, true));
        stream.attach(call);
        if (options.getCancellationToken() != null) {
            CancellationToken.Registration registration = options.getCancellationToken().onCancel(stream::cancel);
            stream.completion().whenComplete((count, error) -> registration.remove());
        }

        logger.debug("ListStream started on handle {}", handle.getId());
        try {
            ClientCalls.asyncServerStreamingCall(call, payload, stream.responseObserver());
        } catch (RuntimeException e) {
            stream.responseObserver().onError(e);
        }
        return stream;
    }

    private <Q, R> CompletableFuture<R> unary(MethodDescriptor<byte[], R> method, WireFormat<Q> format, Q request,
                                              RpcCallOptions options, boolean listCall, String resourceId) {
        CompletableFuture<R> result = new CompletableFuture<>();

        byte[] payload;
        HandleLease lease;
        try {
            payload = encodeRequest(format, request);
            lease = pool.acquire();
        } catch (GatewayException e) {
            result.completeExceptionally(e);
            return result;
        }

        PooledHandle handle = lease.handle();
        ClientCall<byte[], R> call = channel(lease).newCall(method, callOptions(options, listCall));
        logger.debug("Calling {} on handle {}", method.getBareMethodName(), handle.getId());

        StreamObserver<R> responseObserver = new StreamObserver<>() {
            private R value;

            @Override
            public void onNext(R response) {
                value = response;
            }

            @Override
            public void onError(Throwable t) {
                GatewayException error = toGatewayException(t, handle, resourceId);
                lease.close();
                result.completeExceptionally(error);
            }

            @Override
            public void onCompleted() {
                pool.reportSuccess(handle);
                lease.close();
                result.complete(value);
            }
        };

        try {
            ClientCalls.asyncUnaryCall(call, payload, responseObserver);
        } catch (RuntimeException e) {
            responseObserver.onError(e);
            return result;
        }

        CancellationToken.Registration registration = null;
        if (options.getCancellationToken() != null) {
            registration = options.getCancellationToken().onCancel(() -> {
                if (result.completeExceptionally(new CancellationException("Cancelled by caller"))) {
                    call.cancel("Cancelled by caller", null);
                }
            });
        }
        CancellationToken.Registration tokenRegistration = registration;
        result.whenComplete((value, error) -> {
            if (tokenRegistration != null) {
                tokenRegistration.remove();
            }
            if (error instanceof CancellationException) {
                call.cancel("Cancelled by caller", null);
            }
        });
        return result;
    }

    private <Q> byte[] encodeRequest(WireFormat<Q> format, Q request) throws InvalidArgumentException {
        try {
            return codec.encode(format, request);
        } catch (EncodingException e) {
            InvalidArgumentException error = new InvalidArgumentException(
                "Invalid " + format.name() + ": " + e.getMessage(), e);
            error.withContext("codec", format.name());
            throw error;
        }
    }

    private Channel channel(HandleLease lease) {
        return ClientInterceptors.intercept(lease.channel(), requestIdInterceptor);
    }

    private CallOptions callOptions(RpcCallOptions options, boolean listCall) {
        Duration deadline = options.getDeadline() != null ? options.getDeadline() : config.getDefaultDeadline();
        CallOptions callOptions = CallOptions.DEFAULT.withDeadlineAfter(deadline.toNanos(), TimeUnit.NANOSECONDS);
        if (options.getRequestId() != null) {
            callOptions = callOptions.withOption(RequestIdInterceptor.REQUEST_ID, options.getRequestId());
        }

        boolean compress = options.getCompress() != null
            ? options.getCompress()
            : (listCall ? config.isCompressListCalls() : config.isCompressSingleRecordCalls());
        return compress ? callOptions.withCompression(GZIP) : callOptions;
    }

    /**
     * Translate a failed call into the client's error vocabulary and report it to the pool
     */
    GatewayException toGatewayException(Throwable t, PooledHandle handle, String resourceId) {
        Status status = Status.fromThrowable(t);
        pool.reportFault(handle, status);

        GatewayException error;
        DecodingException decoding = findCause(t, DecodingException.class);
        String description = status.getDescription() != null ? status.getDescription() : status.getCode().name();

        if (decoding != null) {
            error = decoding;
        } else if (handle.isRetired()
                   && (status.getCode() == Status.Code.UNAVAILABLE || status.getCode() == Status.Code.CANCELLED)) {
            error = new TransportException("Handle " + handle.getId() + " was retired: " + description, t);
        } else {
            switch (status.getCode()) {
                case NOT_FOUND:
                    error = new NotFoundException(resourceId != null ? resourceId : "unknown",
                                                  "Not found: " + description, t);
                    break;
                case INVALID_ARGUMENT:
                case OUT_OF_RANGE:
                case FAILED_PRECONDITION:
                    error = new InvalidArgumentException(description, t);
                    break;
                case UNAVAILABLE:
                case RESOURCE_EXHAUSTED:
                    error = new UnavailableException(description, t);
                    break;
                case DEADLINE_EXCEEDED:
                    error = new DeadlineExceededException(description, t);
                    break;
                default:
                    error = new InternalException(description, t);
                    break;
            }
        }

        if (error.getKind().isRetryable()) {
            logger.warn("Call on handle {} failed with {}: {}", handle.getId(), status.getCode(), description);
        } else {
            logger.debug("Call on handle {} failed with {}: {}", handle.getId(), status.getCode(), description);
        }
        return error
            .withContext("grpc.status", status.getCode().name())
            .withContext("handle", String.valueOf(handle.getId()));
    }

    private static <E extends Throwable> E findCause(Throwable t, Class<E> type) {
        Throwable current = t;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
