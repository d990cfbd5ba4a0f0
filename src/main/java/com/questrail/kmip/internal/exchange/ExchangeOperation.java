package com.questrail.kmip.internal.exchange;

import com.questrail.kmip.model.Operation;
import com.questrail.kmip.model.RequestPayload;
import com.questrail.kmip.model.ResponsePayload;

import java.util.Optional;

/**
 * One codec-driven KMIP operation: the request payload to send and the rule
 * that turns the sole successful batch item's payload into the caller's
 * output.
 *
 * @param <T> output type; {@link Void} for operations without output
 */
public sealed interface ExchangeOperation<T>
        permits CreateOperation, DestroyOperation, GetSymmetricKeyOperation
{
    RequestPayload requestPayload();

    default Operation operation()
    {
        return requestPayload().operation();
    }

    /**
     * Extract the output of a successful batch item. Called only when the
     * server reported success.
     *
     * @param payload the batch item's payload, if the server sent one
     * @param context the exchange context; output arrays come from its allocator
     */
    T extract(Optional<ResponsePayload> payload, ProtocolContext context) throws ExchangeException;
}
