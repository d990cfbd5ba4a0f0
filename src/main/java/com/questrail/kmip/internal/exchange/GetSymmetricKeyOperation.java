package com.questrail.kmip.internal.exchange;

import com.questrail.kmip.client.KmipStatus;
import com.questrail.kmip.model.KeyBlock;
import com.questrail.kmip.model.KeyFormatType;
import com.questrail.kmip.model.ObjectType;
import com.questrail.kmip.model.RequestPayload;
import com.questrail.kmip.model.ResponsePayload;

import java.util.Objects;
import java.util.Optional;

/**
 * GetSymmetricKeyOperation
 * -----------------------------------------------------------------------------
 * Retrieve the raw bytes of a symmetric key.
 *
 * <p>The returned object must be a symmetric key whose key block is in
 * {@link KeyFormatType#RAW} format and is not wrapped. Anything else is an
 * {@link KmipStatus#OBJECT_MISMATCH}: the server answered, but not with
 * something this call can hand back as plain key bytes.</p>
 *
 * <p>The output array is obtained from the context's allocator and belongs
 * to the caller, who should zero it when done.</p>
 */
public record GetSymmetricKeyOperation(String uniqueIdentifier) implements ExchangeOperation<byte[]>
{
    public GetSymmetricKeyOperation {
        Objects.requireNonNull(uniqueIdentifier, "uniqueIdentifier");
    }

    @Override
    public RequestPayload requestPayload()
    {
        return new RequestPayload.Get(uniqueIdentifier);
    }

    @Override
    public byte[] extract(Optional<ResponsePayload> payload, ProtocolContext context) throws ExchangeException
    {
        if (payload.isEmpty()) {
            throw new ExchangeException(KmipStatus.MALFORMED_RESPONSE, "Get response carries no payload");
        }
        if (!(payload.get() instanceof ResponsePayload.Get got)) {
            throw new ExchangeException(KmipStatus.MALFORMED_RESPONSE,
                    "Get response carries a " + payload.get().getClass().getSimpleName() + " payload");
        }
        if (got.objectType() != ObjectType.SYMMETRIC_KEY) {
            throw new ExchangeException(KmipStatus.OBJECT_MISMATCH,
                    "Expected a symmetric key, server returned " + got.objectType());
        }
        if (got.keyBlock().isEmpty()) {
            throw new ExchangeException(KmipStatus.MALFORMED_RESPONSE, "Symmetric key carries no key block");
        }

        KeyBlock block = got.keyBlock().get();
        if (block.keyFormatType() != KeyFormatType.RAW) {
            throw new ExchangeException(KmipStatus.OBJECT_MISMATCH,
                    "Expected RAW key format, server returned " + block.keyFormatType());
        }
        if (block.keyWrappingData().isPresent()) {
            throw new ExchangeException(KmipStatus.OBJECT_MISMATCH, "Key is wrapped");
        }
        if (block.keyMaterialLength() < 0) {
            throw new ExchangeException(KmipStatus.OBJECT_MISMATCH, "Key value carries no raw key material");
        }

        byte[] key = context.allocateOutput(block.keyMaterialLength());
        block.copyKeyMaterial(key);
        return key;
    }
}
