package com.questrail.kmip.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Operation-specific response payloads the codec understands.
 */
public sealed interface ResponsePayload
        permits ResponsePayload.Create, ResponsePayload.Destroy, ResponsePayload.Get
{
    record Create(ObjectType objectType, String uniqueIdentifier) implements ResponsePayload {
        public Create {
            Objects.requireNonNull(objectType, "objectType");
            Objects.requireNonNull(uniqueIdentifier, "uniqueIdentifier");
        }
    }

    record Destroy(String uniqueIdentifier) implements ResponsePayload {
        public Destroy {
            Objects.requireNonNull(uniqueIdentifier, "uniqueIdentifier");
        }
    }

    /**
     * Get response. {@code keyBlock} is present for key-bearing object types
     * (see {@link ObjectType#carriesKeyBlock()}); other managed objects are not
     * decoded past their type.
     */
    record Get(ObjectType objectType, String uniqueIdentifier, Optional<KeyBlock> keyBlock)
            implements ResponsePayload {
        public Get {
            Objects.requireNonNull(objectType, "objectType");
            Objects.requireNonNull(uniqueIdentifier, "uniqueIdentifier");
            Objects.requireNonNull(keyBlock, "keyBlock");
        }
    }
}
