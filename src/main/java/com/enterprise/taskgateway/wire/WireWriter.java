package com.enterprise.taskgateway.wire;

import com.enterprise.taskgateway.exception.EncodingException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;

/**
 * Append-only big-endian writer for the task wire form.
 * Fails as soon as the message would exceed its size cap.
 */
public class WireWriter {

    private final int maxSize;
    private byte[] buffer;
    private int size;

    public WireWriter(int maxSize) {
        this.maxSize = maxSize;
        this.buffer = new byte[Math.min(128, Math.max(maxSize, 1))];
    }

    public void writeByte(int value) throws EncodingException {
        ensureCapacity(1);
        buffer[size++] = (byte) value;
    }

    public void writeBoolean(boolean value) throws EncodingException {
        writeByte(value ? 1 : 0);
    }

    public void writeInt(int value) throws EncodingException {
        ensureCapacity(4);
        for (int shift = 24; shift >= 0; shift -= 8) {
            buffer[size++] = (byte) (value >>> shift);
        }
    }

    public void writeLong(long value) throws EncodingException {
        ensureCapacity(8);
        for (int shift = 56; shift >= 0; shift -= 8) {
            buffer[size++] = (byte) (value >>> shift);
        }
    }

    /**
     * Unsigned LEB128
     */
    public void writeVarint(int value) throws EncodingException {
        if (value < 0) {
            throw new EncodingException("Negative length prefix: " + value);
        }
        int remaining = value;
        while ((remaining & ~0x7F) != 0) {
            writeByte((remaining & 0x7F) | 0x80);
            remaining >>>= 7;
        }
        writeByte(remaining);
    }

    public void writeUuid(UUID value) throws EncodingException {
        writeLong(value.getMostSignificantBits());
        writeLong(value.getLeastSignificantBits());
    }

    public void writeText(String field, String value) throws EncodingException {
        if (value == null) {
            throw new EncodingException("Field '" + field + "' is required");
        }
        // UTF-8 never takes more than 3 bytes per UTF-16 unit
        if (value.length() > maxSize) {
            throw new EncodingException("Field '" + field + "' exceeds the maximum message size of "
                + maxSize + " bytes");
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > maxSize) {
            throw new EncodingException("Field '" + field + "' is " + bytes.length
                + " bytes, exceeding the maximum message size of " + maxSize + " bytes");
        }
        writeVarint(bytes.length);
        writeBytes(bytes);
    }

    public void writeBytes(byte[] bytes) throws EncodingException {
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, buffer, size, bytes.length);
        size += bytes.length;
    }

    public int size() {
        return size;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    private void ensureCapacity(int additional) throws EncodingException {
        long required = (long) size + additional;
        if (required > maxSize) {
            throw new EncodingException("Message exceeds the maximum encoding size of " + maxSize + " bytes");
        }
        if (required > buffer.length) {
            long grown = Math.max(required, (long) buffer.length * 2);
            buffer = Arrays.copyOf(buffer, (int) Math.min(grown, maxSize));
        }
    }
}
