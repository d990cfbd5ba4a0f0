package com.questrail.kmip.observability;

import com.questrail.kmip.client.KmipStatus;

import java.time.Instant;

/**
 * Record representing an exchange the client itself had to abandon.
 */
public record KmipErrorEvent(
    Instant timestamp,
    String operation,
    KmipStatus status,
    String message,
    Throwable cause
) {
}
