package com.questrail.kmip.codec.impl;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * TtlvReader
 * -----------------------------------------------------------------------------
 * Parses a TTLV byte sequence into a {@link TtlvItem} tree.
 *
 * <p>Every declared length is checked against the bytes actually available
 * before anything is copied, so a hostile length can never trigger an
 * allocation larger than the frame itself. Nesting is capped at
 * {@link #MAX_DEPTH} structures.</p>
 */
final class TtlvReader
{
    static final int MAX_DEPTH = 32;

    private static final int ITEM_HEADER = 8;

    private TtlvReader() {}

    /**
     * Reads exactly one item from {@code in}, advancing its position past the
     * item and its padding.
     */
    static TtlvItem read(ByteBuffer in) throws TtlvFormatException {
        return read(in, 0);
    }

    private static TtlvItem read(ByteBuffer in, int depth) throws TtlvFormatException {
        if (depth > MAX_DEPTH) {
            throw new TtlvFormatException("Structures nested deeper than " + MAX_DEPTH);
        }
        if (in.remaining() < ITEM_HEADER) {
            throw new TtlvFormatException("Truncated item header: " + in.remaining() + " byte(s) left");
        }

        final int tag = ((in.get() & 0xFF) << 16) | ((in.get() & 0xFF) << 8) | (in.get() & 0xFF);
        final TtlvType type = TtlvType.fromCode(in.get() & 0xFF);
        final int length = in.getInt();

        if (length < 0) {
            throw new TtlvFormatException("Negative length for " + TtlvTag.hex(tag));
        }
        if (type.fixedLength() >= 0 && length != type.fixedLength()) {
            throw new TtlvFormatException("Field " + TtlvTag.hex(tag) + " of type " + type
                    + " has length " + length + ", expected " + type.fixedLength());
        }

        if (type == TtlvType.STRUCTURE) {
            if (length > in.remaining()) {
                throw new TtlvFormatException("Structure " + TtlvTag.hex(tag) + " declares "
                        + length + " byte(s), only " + in.remaining() + " available");
            }
            ByteBuffer body = in.slice();
            body.limit(length);
            in.position(in.position() + length);

            List<TtlvItem> children = new ArrayList<>();
            while (body.hasRemaining()) {
                children.add(read(body, depth + 1));
            }
            return TtlvItem.structure(tag, children);
        }

        final long padded = (long) length + TtlvWriter.paddingFor(length);
        if (padded > in.remaining()) {
            throw new TtlvFormatException("Field " + TtlvTag.hex(tag) + " declares "
                    + length + " byte(s), only " + in.remaining() + " available");
        }
        byte[] value = new byte[length];
        in.get(value);
        in.position(in.position() + (int) (padded - length));
        return TtlvItem.primitive(tag, type, value);
    }
}
