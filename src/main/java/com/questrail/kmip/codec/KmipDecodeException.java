package com.questrail.kmip.codec;

/**
 * Indicates that received bytes could not be decoded into a KMIP response
 * message.
 *
 * This typically reflects:
 * <ul>
 *   <li>Truncated or over-long TTLV items</li>
 *   <li>An unexpected tag or item type where a specific field is required</li>
 *   <li>Enumeration values this client does not know</li>
 * </ul>
 */
public final class KmipDecodeException extends RuntimeException
{
    public KmipDecodeException(String message) {
        super(message);
    }

    public KmipDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
