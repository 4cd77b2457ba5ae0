package com.enterprise.taskgateway.wire;

import com.enterprise.taskgateway.exception.DecodingException;
import com.enterprise.taskgateway.exception.EncodingException;

/**
 * Field layout of one message type in the task wire form
 */
public interface WireFormat<T> {

    void write(T value, WireWriter out) throws EncodingException;

    T read(WireReader in) throws DecodingException;

    /**
     * Short name used in error messages and metrics
     */
    String name();
}
