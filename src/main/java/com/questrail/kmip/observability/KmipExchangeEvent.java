package com.questrail.kmip.observability;

import com.questrail.kmip.client.KmipStatus;
import com.questrail.kmip.model.ResultReason;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one completed exchange, successful or server-rejected.
 *
 * <p>{@code resultReason} is null unless the server supplied one. Byte counts
 * cover the full frames, prefix included. No payload content is carried.</p>
 */
public record KmipExchangeEvent(
    Instant timestamp,
    String operation,
    KmipStatus status,
    ResultReason resultReason,
    int bytesSent,
    int bytesReceived
) {
    public KmipExchangeEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(status, "status");
    }
}
