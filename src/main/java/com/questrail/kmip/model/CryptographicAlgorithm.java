package com.questrail.kmip.model;

import java.util.Optional;

/**
 * KMIP Cryptographic Algorithm enumeration (KMIP 1.0 §9.1.3.2.13).
 */
public enum CryptographicAlgorithm
{
    DES(0x01),
    TRIPLE_DES(0x02),
    AES(0x03),
    RSA(0x04),
    DSA(0x05),
    ECDSA(0x06),
    HMAC_SHA1(0x07),
    HMAC_SHA224(0x08),
    HMAC_SHA256(0x09),
    HMAC_SHA384(0x0A),
    HMAC_SHA512(0x0B),
    HMAC_MD5(0x0C),
    DH(0x0D),
    ECDH(0x0E),
    ECMQV(0x0F),
    BLOWFISH(0x10),
    CAMELLIA(0x11),
    CAST5(0x12),
    IDEA(0x13),
    MARS(0x14),
    RC2(0x15),
    RC4(0x16),
    RC5(0x17),
    SKIPJACK(0x18),
    TWOFISH(0x19);

    private final int code;

    CryptographicAlgorithm(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<CryptographicAlgorithm> fromCode(int code) {
        for (CryptographicAlgorithm a : values()) {
            if (a.code == code) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }
}
