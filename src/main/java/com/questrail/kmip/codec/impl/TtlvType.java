package com.questrail.kmip.codec.impl;

/**
 * TTLV item types (KMIP 1.0 §9.1.1.2).
 */
enum TtlvType
{
    STRUCTURE(0x01),
    INTEGER(0x02),
    LONG_INTEGER(0x03),
    BIG_INTEGER(0x04),
    ENUMERATION(0x05),
    BOOLEAN(0x06),
    TEXT_STRING(0x07),
    BYTE_STRING(0x08),
    DATE_TIME(0x09),
    INTERVAL(0x0A);

    private final int code;

    TtlvType(int code) {
        this.code = code;
    }

    int code() {
        return code;
    }

    /**
     * Fixed value length for primitive types, or -1 where the length is
     * carried by the item itself.
     */
    int fixedLength() {
        return switch (this) {
            case INTEGER, ENUMERATION, INTERVAL -> 4;
            case LONG_INTEGER, BOOLEAN, DATE_TIME -> 8;
            default -> -1;
        };
    }

    static TtlvType fromCode(int code) throws TtlvFormatException {
        for (TtlvType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        throw new TtlvFormatException("Unknown TTLV item type 0x" + Integer.toHexString(code));
    }
}
