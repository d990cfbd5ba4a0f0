package com.questrail.kmip.model;

import java.util.Objects;

/**
 * Operation-specific request payloads.
 *
 * <p>The variant is closed: the client issues only Create, Destroy and Get
 * requests through the codec. Raw passthrough requests never take this form.</p>
 */
public sealed interface RequestPayload
        permits RequestPayload.Create, RequestPayload.Destroy, RequestPayload.Get
{
    /**
     * The operation this payload belongs to.
     */
    Operation operation();

    record Create(ObjectType objectType, TemplateAttribute templateAttribute) implements RequestPayload {
        public Create {
            Objects.requireNonNull(objectType, "objectType");
            Objects.requireNonNull(templateAttribute, "templateAttribute");
        }

        @Override
        public Operation operation() {
            return Operation.CREATE;
        }
    }

    record Destroy(String uniqueIdentifier) implements RequestPayload {
        public Destroy {
            Objects.requireNonNull(uniqueIdentifier, "uniqueIdentifier");
        }

        @Override
        public Operation operation() {
            return Operation.DESTROY;
        }
    }

    record Get(String uniqueIdentifier) implements RequestPayload {
        public Get {
            Objects.requireNonNull(uniqueIdentifier, "uniqueIdentifier");
        }

        @Override
        public Operation operation() {
            return Operation.GET;
        }
    }
}
