package com.questrail.kmip.config;

import com.questrail.kmip.codec.KmipFraming;
import com.questrail.kmip.model.ProtocolVersion;

import java.util.Objects;

/**
 * Static configuration of a {@link com.questrail.kmip.client.KmipClient}.
 *
 * <ul>
 *   <li>{@code protocolVersion}: stamped on every request header; no negotiation</li>
 *   <li>{@code maxMessageSize}: default ceiling on the server-declared body length,
 *       also sent as the request's maximum response size</li>
 *   <li>{@code encodeBlockSize}: initial encode buffer size and the increment
 *       added on each "buffer too small" retry</li>
 * </ul>
 */
public record KmipClientConfig(
    ProtocolVersion protocolVersion,
    int maxMessageSize,
    int encodeBlockSize
) {
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 8192;
    public static final int DEFAULT_ENCODE_BLOCK_SIZE = 1024;

    public KmipClientConfig {
        Objects.requireNonNull(protocolVersion, "protocolVersion");
        if (maxMessageSize <= 0 || maxMessageSize > Integer.MAX_VALUE - KmipFraming.HEADER_WIDTH) {
            throw new IllegalArgumentException("maxMessageSize must be in 1.."
                + (Integer.MAX_VALUE - KmipFraming.HEADER_WIDTH) + ", was " + maxMessageSize);
        }
        if (encodeBlockSize <= 0) {
            throw new IllegalArgumentException("encodeBlockSize must be positive, was " + encodeBlockSize);
        }
    }

    public static KmipClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ProtocolVersion protocolVersion = ProtocolVersion.KMIP_1_0;
        private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
        private int encodeBlockSize = DEFAULT_ENCODE_BLOCK_SIZE;

        public Builder withProtocolVersion(ProtocolVersion protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder withMaxMessageSize(int maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public Builder withEncodeBlockSize(int encodeBlockSize) {
            this.encodeBlockSize = encodeBlockSize;
            return this;
        }

        public KmipClientConfig build() {
            return new KmipClientConfig(protocolVersion, maxMessageSize, encodeBlockSize);
        }
    }
}
