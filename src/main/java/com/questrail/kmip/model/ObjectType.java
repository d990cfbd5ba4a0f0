package com.questrail.kmip.model;

import java.util.Optional;

/**
 * KMIP Object Type enumeration (KMIP 1.0 §9.1.3.2.12).
 */
public enum ObjectType
{
    CERTIFICATE(0x01),
    SYMMETRIC_KEY(0x02),
    PUBLIC_KEY(0x03),
    PRIVATE_KEY(0x04),
    SPLIT_KEY(0x05),
    TEMPLATE(0x06),
    SECRET_DATA(0x07),
    OPAQUE_OBJECT(0x08);

    private final int code;

    ObjectType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Returns true for object types whose managed object begins with a key block.
     */
    public boolean carriesKeyBlock() {
        return this == SYMMETRIC_KEY || this == PUBLIC_KEY || this == PRIVATE_KEY;
    }

    public static Optional<ObjectType> fromCode(int code) {
        for (ObjectType t : values()) {
            if (t.code == code) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
