package com.questrail.kmip.model;

import java.util.Objects;

/**
 * Typed value of a template attribute.
 *
 * <p>The variant determines the TTLV type the codec emits for the
 * {@code Attribute Value} field.</p>
 */
public sealed interface AttributeValue
        permits AttributeValue.TextString,
                AttributeValue.Int,
                AttributeValue.Enumeration,
                AttributeValue.ByteString,
                AttributeValue.Name
{
    record TextString(String value) implements AttributeValue {
        public TextString {
            Objects.requireNonNull(value, "value");
        }
    }

    record Int(int value) implements AttributeValue {
    }

    record Enumeration(int code) implements AttributeValue {
    }

    record ByteString(byte[] value) implements AttributeValue {
        public ByteString {
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }
    }

    /**
     * The structured value of the {@code Name} attribute.
     */
    record Name(String value, NameType type) implements AttributeValue {
        public Name {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(type, "type");
        }
    }
}
