package com.questrail.kmip.internal.exchange;

import com.questrail.kmip.model.RequestPayload;
import com.questrail.kmip.model.ResponsePayload;

import java.util.Objects;
import java.util.Optional;

/**
 * Destroy a managed object by identifier. Only the result status matters;
 * the response payload is ignored.
 */
public record DestroyOperation(String uniqueIdentifier) implements ExchangeOperation<Void>
{
    public DestroyOperation {
        Objects.requireNonNull(uniqueIdentifier, "uniqueIdentifier");
    }

    @Override
    public RequestPayload requestPayload()
    {
        return new RequestPayload.Destroy(uniqueIdentifier);
    }

    @Override
    public Void extract(Optional<ResponsePayload> payload, ProtocolContext context)
    {
        return null;
    }
}
