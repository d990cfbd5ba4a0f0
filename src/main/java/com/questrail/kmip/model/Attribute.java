package com.questrail.kmip.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A single named attribute inside a {@link TemplateAttribute}.
 *
 * <p>{@code index} is only sent when present; KMIP treats an absent index as 0.</p>
 */
public record Attribute(String name, Optional<Integer> index, AttributeValue value)
{
    public static final String CRYPTOGRAPHIC_ALGORITHM = "Cryptographic Algorithm";
    public static final String CRYPTOGRAPHIC_LENGTH = "Cryptographic Length";
    public static final String CRYPTOGRAPHIC_USAGE_MASK = "Cryptographic Usage Mask";
    public static final String NAME = "Name";

    public Attribute {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(value, "value");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Attribute name must not be empty");
        }
        if (index.isPresent() && index.get() < 0) {
            throw new IllegalArgumentException("Attribute index must be non-negative");
        }
    }

    public static Attribute of(String name, AttributeValue value) {
        return new Attribute(name, Optional.empty(), value);
    }

    public static Attribute cryptographicAlgorithm(CryptographicAlgorithm algorithm) {
        return of(CRYPTOGRAPHIC_ALGORITHM, new AttributeValue.Enumeration(algorithm.code()));
    }

    public static Attribute cryptographicLength(int bits) {
        if (bits <= 0) {
            throw new IllegalArgumentException("Cryptographic length must be positive");
        }
        return of(CRYPTOGRAPHIC_LENGTH, new AttributeValue.Int(bits));
    }

    /**
     * @param mask bitwise OR of {@link CryptographicUsageMask} flags
     */
    public static Attribute cryptographicUsageMask(int mask) {
        return of(CRYPTOGRAPHIC_USAGE_MASK, new AttributeValue.Int(mask));
    }

    public static Attribute name(String name) {
        return of(NAME, new AttributeValue.Name(name, NameType.UNINTERPRETED_TEXT_STRING));
    }
}
