package com.questrail.kmip.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Response header as decoded. {@code batchCount} is the server's declared
 * count and is validated against the decoded batch items by the exchange
 * engine, not here.
 */
public record ResponseHeader(ProtocolVersion protocolVersion, Instant timeStamp, int batchCount)
{
    public ResponseHeader {
        Objects.requireNonNull(protocolVersion, "protocolVersion");
        Objects.requireNonNull(timeStamp, "timeStamp");
    }
}
