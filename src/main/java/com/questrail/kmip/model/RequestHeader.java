package com.questrail.kmip.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Request header: protocol version, the response size ceiling the server must
 * honor, the request time stamp and the number of batch items that follow.
 */
public record RequestHeader(
        ProtocolVersion protocolVersion,
        int maximumResponseSize,
        Instant timeStamp,
        int batchCount
) {
    public RequestHeader {
        Objects.requireNonNull(protocolVersion, "protocolVersion");
        Objects.requireNonNull(timeStamp, "timeStamp");
        if (maximumResponseSize <= 0) {
            throw new IllegalArgumentException("maximumResponseSize must be positive");
        }
    }
}
