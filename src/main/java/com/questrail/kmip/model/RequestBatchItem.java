package com.questrail.kmip.model;

import java.util.Objects;

public record RequestBatchItem(Operation operation, RequestPayload payload)
{
    public RequestBatchItem {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(payload, "payload");
        if (payload.operation() != operation) {
            throw new IllegalArgumentException(
                    "Payload for " + payload.operation() + " cannot be sent as " + operation);
        }
    }

    public static RequestBatchItem of(RequestPayload payload) {
        return new RequestBatchItem(payload.operation(), payload);
    }
}
