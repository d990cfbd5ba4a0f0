package com.questrail.kmip.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Presence of this structure in a key block means the key material is wrapped.
 * Only the fields needed to describe the wrapping are retained.
 */
public record KeyWrappingData(WrappingMethod wrappingMethod, Optional<String> encryptionKeyIdentifier)
{
    public KeyWrappingData {
        Objects.requireNonNull(wrappingMethod, "wrappingMethod");
        Objects.requireNonNull(encryptionKeyIdentifier, "encryptionKeyIdentifier");
    }
}
