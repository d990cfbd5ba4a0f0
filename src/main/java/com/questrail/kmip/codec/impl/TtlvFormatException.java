package com.questrail.kmip.codec.impl;

/**
 * Raised by the TTLV reader for byte-level defects: truncated items, bad
 * lengths, unknown item types, excessive nesting.
 */
final class TtlvFormatException extends Exception
{
    TtlvFormatException(String message) {
        super(message);
    }
}
