package com.questrail.kmip.codec.impl;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * TtlvItem
 * -----------------------------------------------------------------------------
 * One decoded TTLV item: a structure with children, or a primitive with its
 * unpadded value bytes.
 *
 * <p>Typed accessors check the item type and raise {@link TtlvFormatException}
 * on a mismatch so that structural mapping code can stay linear.</p>
 */
final class TtlvItem
{
    private final int tag;
    private final TtlvType type;
    private final byte[] value;
    private final List<TtlvItem> children;

    private TtlvItem(int tag, TtlvType type, byte[] value, List<TtlvItem> children) {
        this.tag = tag;
        this.type = type;
        this.value = value;
        this.children = children;
    }

    static TtlvItem primitive(int tag, TtlvType type, byte[] value) {
        return new TtlvItem(tag, type, value, List.of());
    }

    static TtlvItem structure(int tag, List<TtlvItem> children) {
        return new TtlvItem(tag, TtlvType.STRUCTURE, new byte[0], List.copyOf(children));
    }

    int tag() {
        return tag;
    }

    TtlvType type() {
        return type;
    }

    List<TtlvItem> children() {
        return children;
    }

    Optional<TtlvItem> find(int childTag) {
        for (TtlvItem child : children) {
            if (child.tag == childTag) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    TtlvItem require(int childTag) throws TtlvFormatException {
        return find(childTag).orElseThrow(() -> new TtlvFormatException(
                "Missing required field " + TtlvTag.hex(childTag) + " in " + TtlvTag.hex(tag)));
    }

    List<TtlvItem> all(int childTag) {
        List<TtlvItem> matches = new ArrayList<>();
        for (TtlvItem child : children) {
            if (child.tag == childTag) {
                matches.add(child);
            }
        }
        return matches;
    }

    int asInteger() throws TtlvFormatException {
        expect(TtlvType.INTEGER);
        return ByteBuffer.wrap(value).getInt();
    }

    int asEnumeration() throws TtlvFormatException {
        expect(TtlvType.ENUMERATION);
        return ByteBuffer.wrap(value).getInt();
    }

    Instant asDateTime() throws TtlvFormatException {
        expect(TtlvType.DATE_TIME);
        long seconds = ByteBuffer.wrap(value).getLong();
        try {
            return Instant.ofEpochSecond(seconds);
        }
        catch (DateTimeException e) {
            throw new TtlvFormatException("Date-Time out of range: " + seconds);
        }
    }

    String asTextString() throws TtlvFormatException {
        expect(TtlvType.TEXT_STRING);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(value))
                    .toString();
        }
        catch (CharacterCodingException e) {
            throw new TtlvFormatException("Text string " + TtlvTag.hex(tag) + " is not valid UTF-8");
        }
    }

    byte[] asByteString() throws TtlvFormatException {
        expect(TtlvType.BYTE_STRING);
        return value.clone();
    }

    boolean isStructure() {
        return type == TtlvType.STRUCTURE;
    }

    private void expect(TtlvType expected) throws TtlvFormatException {
        if (type != expected) {
            throw new TtlvFormatException("Field " + TtlvTag.hex(tag) + " has type " + type
                    + ", expected " + expected);
        }
    }
}
