package com.enterprise.taskgateway.rpc;

import com.enterprise.taskgateway.exception.DecodingException;
import com.enterprise.taskgateway.exception.EncodingException;
import com.enterprise.taskgateway.wire.TaskWireCodec;
import com.enterprise.taskgateway.wire.WireFormat;
import io.grpc.MethodDescriptor;
import io.grpc.Status;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * gRPC marshaller backed by the task wire codec. Codec failures surface as
 * a {@link io.grpc.StatusRuntimeException} whose cause is the codec exception.
 */
class WireMarshaller<T> implements MethodDescriptor.Marshaller<T> {

    private final TaskWireCodec codec;
    private final WireFormat<T> format;
    private final Status.Code failureCode;

    WireMarshaller(TaskWireCodec codec, WireFormat<T> format, Status.Code failureCode) {
        this.codec = codec;
        this.format = format;
        this.failureCode = failureCode;
    }

    @Override
    public InputStream stream(T value) {
        try {
            return new ByteArrayInputStream(codec.encode(format, value));
        } catch (EncodingException e) {
            throw Status.fromCode(failureCode)
                .withDescription(e.getMessage())
                .withCause(e)
                .asRuntimeException();
        }
    }

    @Override
    public T parse(InputStream stream) {
        try {
            return codec.decode(format, stream.readAllBytes());
        } catch (DecodingException e) {
            throw Status.fromCode(failureCode)
                .withDescription(e.getMessage())
                .withCause(e)
                .asRuntimeException();
        } catch (IOException e) {
            throw Status.INTERNAL
                .withDescription("Failed to read " + format.name() + " message")
                .withCause(e)
                .asRuntimeException();
        }
    }

    /**
     * Pass-through marshaller for requests the client has already encoded
     */
    static final MethodDescriptor.Marshaller<byte[]> PRE_ENCODED = new MethodDescriptor.Marshaller<>() {
        @Override
        public InputStream stream(byte[] value) {
            return new ByteArrayInputStream(value);
        }

        @Override
        public byte[] parse(InputStream stream) {
            try {
                return stream.readAllBytes();
            } catch (IOException e) {
                throw Status.INTERNAL.withDescription("Failed to read message").withCause(e).asRuntimeException();
            }
        }
    };
}
