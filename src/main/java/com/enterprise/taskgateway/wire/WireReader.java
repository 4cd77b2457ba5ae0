package com.enterprise.taskgateway.wire;

import com.enterprise.taskgateway.exception.DecodingException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Bounds-checked big-endian reader for the task wire form. Every read that
 * runs past the end raises {@link DecodingException}; nothing is returned
 * half-populated.
 */
public class WireReader {

    private final byte[] data;
    private int position;

    public WireReader(byte[] data) {
        this.data = data;
    }

    public int readByte(String field) throws DecodingException {
        require(field, 1);
        return data[position++] & 0xFF;
    }

    public boolean readBoolean(String field) throws DecodingException {
        int value = readByte(field);
        if (value > 1) {
            throw new DecodingException("Invalid boolean " + value + " for field '" + field + "'");
        }
        return value == 1;
    }

    /**
     * Read the presence byte that precedes an optional field
     */
    public boolean readPresence(String field) throws DecodingException {
        int flag = readByte(field);
        if (flag > 1) {
            throw new DecodingException("Invalid presence flag " + flag + " for field '" + field + "'");
        }
        return flag == 1;
    }

    public int readInt(String field) throws DecodingException {
        require(field, 4);
        int value = 0;
        for (int i = 0; i < 4; i++) {
            value = (value << 8) | (data[position++] & 0xFF);
        }
        return value;
    }

    public long readLong(String field) throws DecodingException {
        require(field, 8);
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value = (value << 8) | (data[position++] & 0xFFL);
        }
        return value;
    }

    public int readVarint(String field) throws DecodingException {
        int value = 0;
        for (int shift = 0; shift < 35; shift += 7) {
            int b = readByte(field);
            // The fifth byte may only carry bits 28..30 of a non-negative int
            if (shift == 28 && b > 0x07) {
                throw new DecodingException("Length prefix overflow for field '" + field + "'");
            }
            value |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        throw new DecodingException("Malformed length prefix for field '" + field + "'");
    }

    public UUID readUuid(String field) throws DecodingException {
        require(field, 16);
        return new UUID(readLong(field), readLong(field));
    }

    public String readText(String field) throws DecodingException {
        int length = readVarint(field);
        require(field, length);
        try {
            String value = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(data, position, length))
                .toString();
            position += length;
            return value;
        } catch (CharacterCodingException e) {
            throw new DecodingException("Field '" + field + "' is not valid UTF-8", e);
        }
    }

    public byte[] readBytes(String field, int length) throws DecodingException {
        require(field, length);
        byte[] out = new byte[length];
        System.arraycopy(data, position, out, 0, length);
        position += length;
        return out;
    }

    public int remaining() {
        return data.length - position;
    }

    private void require(String field, int length) throws DecodingException {
        if (length < 0 || length > data.length - position) {
            throw new DecodingException("Truncated input: field '" + field + "' needs " + length
                + " bytes at offset " + position + " but only " + (data.length - position) + " remain");
        }
    }
}
