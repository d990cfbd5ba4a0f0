package com.questrail.kmip.codec;

import java.util.Objects;

/**
 * Outcome of a single {@link KmipCodec#encodeRequest} attempt.
 */
public sealed interface EncodeResult
        permits EncodeResult.Encoded, EncodeResult.BufferTooSmall, EncodeResult.Failed
{
    /**
     * The request was fully encoded into {@code length} bytes.
     */
    record Encoded(int length) implements EncodeResult {
        public Encoded {
            if (length <= 0) {
                throw new IllegalArgumentException("Encoded length must be positive");
            }
        }
    }

    /**
     * The target buffer ran out of room before the encoding finished.
     */
    record BufferTooSmall() implements EncodeResult {
    }

    /**
     * Any encoding failure other than running out of room.
     */
    record Failed(String reason) implements EncodeResult {
        public Failed {
            Objects.requireNonNull(reason, "reason");
        }
    }

    static EncodeResult encoded(int length) {
        return new Encoded(length);
    }

    static EncodeResult bufferTooSmall() {
        return new BufferTooSmall();
    }

    static EncodeResult failed(String reason) {
        return new Failed(reason);
    }
}
