package com.questrail.kmip.model;

/**
 * Bit flags for the {@code Cryptographic Usage Mask} attribute.
 */
public final class CryptographicUsageMask
{
    public static final int SIGN = 0x0001;
    public static final int VERIFY = 0x0002;
    public static final int ENCRYPT = 0x0004;
    public static final int DECRYPT = 0x0008;
    public static final int WRAP_KEY = 0x0010;
    public static final int UNWRAP_KEY = 0x0020;
    public static final int EXPORT = 0x0040;
    public static final int MAC_GENERATE = 0x0080;
    public static final int MAC_VERIFY = 0x0100;
    public static final int DERIVE_KEY = 0x0200;
    public static final int CONTENT_COMMITMENT = 0x0400;
    public static final int KEY_AGREEMENT = 0x0800;
    public static final int CERTIFICATE_SIGN = 0x1000;
    public static final int CRL_SIGN = 0x2000;

    private CryptographicUsageMask() {}
}
