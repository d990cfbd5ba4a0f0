package com.questrail.kmip.internal.exchange;

import com.questrail.kmip.client.KmipStatus;
import com.questrail.kmip.model.ObjectType;
import com.questrail.kmip.model.RequestPayload;
import com.questrail.kmip.model.ResponsePayload;
import com.questrail.kmip.model.TemplateAttribute;

import java.util.Objects;
import java.util.Optional;

/**
 * Create a symmetric key from a template; the output is the server-assigned
 * unique identifier.
 *
 * <p>The identifier is returned as an immutable {@code String} and is not
 * obtained through {@link ProtocolContext#allocateOutput(int)}.</p>
 */
public record CreateOperation(TemplateAttribute templateAttribute) implements ExchangeOperation<String>
{
    public CreateOperation {
        Objects.requireNonNull(templateAttribute, "templateAttribute");
    }

    @Override
    public RequestPayload requestPayload()
    {
        return new RequestPayload.Create(ObjectType.SYMMETRIC_KEY, templateAttribute);
    }

    @Override
    public String extract(Optional<ResponsePayload> payload, ProtocolContext context) throws ExchangeException
    {
        if (payload.isEmpty()) {
            throw new ExchangeException(KmipStatus.MALFORMED_RESPONSE, "Create response carries no payload");
        }
        if (!(payload.get() instanceof ResponsePayload.Create created)) {
            throw new ExchangeException(KmipStatus.MALFORMED_RESPONSE,
                    "Create response carries a " + payload.get().getClass().getSimpleName() + " payload");
        }
        return created.uniqueIdentifier();
    }
}
