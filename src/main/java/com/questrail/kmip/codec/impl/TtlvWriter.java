package com.questrail.kmip.codec.impl;

import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * TtlvWriter
 * -----------------------------------------------------------------------------
 * Writes TTLV items straight into a fixed-capacity {@link ByteBuffer}.
 *
 * <p>No intermediate copy is made: when the target runs out of room the
 * underlying {@link BufferOverflowException} propagates and the partially
 * written bytes are abandoned by the caller.</p>
 *
 * <p>Structures are written by reserving their header, writing children and
 * back-patching the length in {@link #endStructure(int)}.</p>
 */
final class TtlvWriter
{
    private static final int ITEM_HEADER = 8;

    private final ByteBuffer out;

    TtlvWriter(ByteBuffer out) {
        this.out = Objects.requireNonNull(out, "out");
        if (out.order() != ByteOrder.BIG_ENDIAN) {
            throw new IllegalArgumentException("TTLV target must be big-endian");
        }
    }

    /**
     * Opens a structure and returns the mark to pass to {@link #endStructure(int)}.
     */
    int beginStructure(int tag) {
        writeHeader(tag, TtlvType.STRUCTURE, 0);
        return out.position();
    }

    void endStructure(int mark) {
        int length = out.position() - mark;
        out.putInt(mark - 4, length);
    }

    void writeInteger(int tag, int value) {
        writeHeader(tag, TtlvType.INTEGER, 4);
        out.putInt(value);
        pad(4);
    }

    void writeEnumeration(int tag, int value) {
        writeHeader(tag, TtlvType.ENUMERATION, 4);
        out.putInt(value);
        pad(4);
    }

    void writeDateTime(int tag, Instant value) {
        writeHeader(tag, TtlvType.DATE_TIME, 8);
        out.putLong(value.getEpochSecond());
    }

    void writeTextString(int tag, String value) {
        writeBytes(tag, TtlvType.TEXT_STRING, value.getBytes(StandardCharsets.UTF_8));
    }

    void writeByteString(int tag, byte[] value) {
        writeBytes(tag, TtlvType.BYTE_STRING, value);
    }

    private void writeBytes(int tag, TtlvType type, byte[] value) {
        writeHeader(tag, type, value.length);
        out.put(value);
        pad(value.length);
    }

    private void writeHeader(int tag, TtlvType type, int length) {
        if (out.remaining() < ITEM_HEADER) {
            throw new BufferOverflowException();
        }
        out.put((byte) (tag >>> 16));
        out.put((byte) (tag >>> 8));
        out.put((byte) tag);
        out.put((byte) type.code());
        out.putInt(length);
    }

    private void pad(int valueLength) {
        int padding = paddingFor(valueLength);
        for (int i = 0; i < padding; i++) {
            out.put((byte) 0);
        }
    }

    static int paddingFor(int valueLength) {
        int rem = valueLength % 8;
        return rem == 0 ? 0 : 8 - rem;
    }
}
