package com.questrail.kmip.model;

import java.util.Optional;

/**
 * KMIP Wrapping Method enumeration.
 */
public enum WrappingMethod
{
    ENCRYPT(0x01),
    MAC_SIGN(0x02),
    ENCRYPT_THEN_MAC_SIGN(0x03),
    MAC_SIGN_THEN_ENCRYPT(0x04),
    TR_31(0x05);

    private final int code;

    WrappingMethod(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<WrappingMethod> fromCode(int code) {
        for (WrappingMethod m : values()) {
            if (m.code == code) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
