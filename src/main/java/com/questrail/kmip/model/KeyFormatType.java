package com.questrail.kmip.model;

import java.util.Optional;

/**
 * KMIP Key Format Type enumeration (KMIP 1.0 §9.1.3.2.3).
 */
public enum KeyFormatType
{
    RAW(0x01),
    OPAQUE(0x02),
    PKCS_1(0x03),
    PKCS_8(0x04),
    X_509(0x05),
    EC_PRIVATE_KEY(0x06),
    TRANSPARENT_SYMMETRIC_KEY(0x07),
    TRANSPARENT_DSA_PRIVATE_KEY(0x08),
    TRANSPARENT_DSA_PUBLIC_KEY(0x09),
    TRANSPARENT_RSA_PRIVATE_KEY(0x0A),
    TRANSPARENT_RSA_PUBLIC_KEY(0x0B),
    TRANSPARENT_DH_PRIVATE_KEY(0x0C),
    TRANSPARENT_DH_PUBLIC_KEY(0x0D),
    TRANSPARENT_ECDSA_PRIVATE_KEY(0x0E),
    TRANSPARENT_ECDSA_PUBLIC_KEY(0x0F),
    TRANSPARENT_ECDH_PRIVATE_KEY(0x10),
    TRANSPARENT_ECDH_PUBLIC_KEY(0x11),
    TRANSPARENT_ECMQV_PRIVATE_KEY(0x12),
    TRANSPARENT_ECMQV_PUBLIC_KEY(0x13);

    private final int code;

    KeyFormatType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<KeyFormatType> fromCode(int code) {
        for (KeyFormatType t : values()) {
            if (t.code == code) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
