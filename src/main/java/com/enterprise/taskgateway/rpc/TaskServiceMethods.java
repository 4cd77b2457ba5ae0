package com.enterprise.taskgateway.rpc;

import com.enterprise.taskgateway.wire.Empty;
import com.enterprise.taskgateway.wire.Task;
import com.enterprise.taskgateway.wire.TaskDraft;
import com.enterprise.taskgateway.wire.TaskQuery;
import com.enterprise.taskgateway.wire.TaskWireCodec;
import com.enterprise.taskgateway.wire.WireFormat;
import io.grpc.MethodDescriptor;
import io.grpc.Status;

import java.util.List;
import java.util.UUID;

/**
 * Method descriptors of {@code tasks.TasksService}, marshalled with the task wire codec.
 * Client-side descriptors take pre-encoded request bytes so that encoding
 * failures are reported before anything is sent.
 */
public class TaskServiceMethods {

    public static final String SERVICE_NAME = "tasks.TasksService";

    private final MethodDescriptor<TaskDraft, Task> create;
    private final MethodDescriptor<UUID, Task> getById;
    private final MethodDescriptor<TaskQuery, List<Task>> list;
    private final MethodDescriptor<TaskQuery, Task> listStream;
    private final MethodDescriptor<Task, Task> updateById;
    private final MethodDescriptor<UUID, Empty> deleteById;

    public TaskServiceMethods(TaskWireCodec codec) {
        this.create = unary(codec, "Create", TaskWireCodec.TASK_DRAFT, TaskWireCodec.TASK);
        this.getById = unary(codec, "GetById", TaskWireCodec.TASK_ID, TaskWireCodec.TASK);
        this.list = unary(codec, "List", TaskWireCodec.TASK_QUERY, TaskWireCodec.TASK_LIST);
        this.listStream = MethodDescriptor.<TaskQuery, Task>newBuilder()
            .setType(MethodDescriptor.MethodType.SERVER_STREAMING)
            .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE_NAME, "ListStream"))
            .setRequestMarshaller(requestMarshaller(codec, TaskWireCodec.TASK_QUERY))
            .setResponseMarshaller(responseMarshaller(codec, TaskWireCodec.TASK))
            .build();
        this.updateById = unary(codec, "UpdateById", TaskWireCodec.TASK, TaskWireCodec.TASK);
        this.deleteById = unary(codec, "DeleteById", TaskWireCodec.TASK_ID, TaskWireCodec.EMPTY);
    }

    public MethodDescriptor<TaskDraft, Task> create() { return create; }
    public MethodDescriptor<UUID, Task> getById() { return getById; }
    public MethodDescriptor<TaskQuery, List<Task>> list() { return list; }
    public MethodDescriptor<TaskQuery, Task> listStream() { return listStream; }
    public MethodDescriptor<Task, Task> updateById() { return updateById; }
    public MethodDescriptor<UUID, Empty> deleteById() { return deleteById; }

    /**
     * The same method with a pass-through request marshaller
     */
    public static <Q, R> MethodDescriptor<byte[], R> preEncoded(MethodDescriptor<Q, R> method) {
        return method.toBuilder(WireMarshaller.PRE_ENCODED, method.getResponseMarshaller()).build();
    }

    private static <Q, R> MethodDescriptor<Q, R> unary(TaskWireCodec codec, String name,
                                                        WireFormat<Q> request, WireFormat<R> response) {
        return MethodDescriptor.<Q, R>newBuilder()
            .setType(MethodDescriptor.MethodType.UNARY)
            .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE_NAME, name))
            .setRequestMarshaller(requestMarshaller(codec, request))
            .setResponseMarshaller(responseMarshaller(codec, response))
            .build();
    }

    private static <T> MethodDescriptor.Marshaller<T> requestMarshaller(TaskWireCodec codec, WireFormat<T> format) {
        return new WireMarshaller<>(codec, format, Status.Code.INVALID_ARGUMENT);
    }

    private static <T> MethodDescriptor.Marshaller<T> responseMarshaller(TaskWireCodec codec, WireFormat<T> format) {
        return new WireMarshaller<>(codec, format, Status.Code.INTERNAL);
    }
}
