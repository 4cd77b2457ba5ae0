package com.enterprise.taskgateway.wire;

/**
 * The zero-byte response of DeleteById
 */
public final class Empty {

    public static final Empty INSTANCE = new Empty();

    private Empty() {
    }

    @Override
    public String toString() {
        return "Empty";
    }
}
