package com.questrail.kmip.client;

import com.questrail.kmip.codec.KmipCodec;
import com.questrail.kmip.codec.impl.DefaultKmipCodec;
import com.questrail.kmip.config.KmipClientConfig;
import com.questrail.kmip.internal.buffer.BufferAllocator;
import com.questrail.kmip.internal.buffer.NettyBufferAllocator;
import com.questrail.kmip.internal.exchange.CreateOperation;
import com.questrail.kmip.internal.exchange.DestroyOperation;
import com.questrail.kmip.internal.exchange.ExchangeOrchestrator;
import com.questrail.kmip.internal.exchange.GetSymmetricKeyOperation;
import com.questrail.kmip.internal.exchange.ProtocolContext;
import com.questrail.kmip.internal.time.SystemWallClock;
import com.questrail.kmip.internal.time.WallClock;
import com.questrail.kmip.model.TemplateAttribute;
import com.questrail.kmip.observability.KmipObservabilitySink;
import com.questrail.kmip.observability.NullObservabilitySink;
import com.questrail.kmip.transport.KmipTransport;

import java.util.Objects;

/**
 * KmipClient
 * =============================================================================
 * Blocking KMIP client over an already-established, already-secured transport.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@code create}: create a symmetric key; output is its unique identifier</li>
 *   <li>{@code destroy}: destroy a managed object; no output</li>
 *   <li>{@code getSymmetricKey}: fetch unwrapped raw key bytes</li>
 *   <li>{@code sendRawRequest}: send pre-encoded bytes, return the undecoded
 *       response frame</li>
 * </ul>
 *
 * <p>Every operation returns a {@link KmipOutcome}; protocol, I/O and
 * allocation failures never surface as exceptions. Each operation comes in
 * three forms: with the configured maximum message size, with an explicit
 * one, and on a caller-supplied {@link ProtocolContext} from
 * {@link #newContext()}.</p>
 *
 * <h2>Ownership</h2>
 * <p>Returned identifiers, key bytes and raw response frames belong to the
 * caller. Key bytes and raw frames are obtained from the configured
 * {@link BufferAllocator}; identifiers from {@code create} are plain
 * {@code String}s and do not pass through it. Key bytes should be zeroed by
 * the caller once used.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>The client may be shared. Calls that create their own context are
 * independent. A context passed in explicitly must not be used by two calls
 * at once; the caller provides any locking.</p>
 */
public final class KmipClient
{
    private final KmipClientConfig config;
    private final BufferAllocator allocator;
    private final ExchangeOrchestrator orchestrator;

    private KmipClient(Builder builder)
    {
        this.config = builder.config;
        this.allocator = builder.allocator;
        this.orchestrator = new ExchangeOrchestrator(
                builder.codec,
                config.encodeBlockSize(),
                builder.wallClock,
                builder.observabilitySink);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public KmipClientConfig config()
    {
        return config;
    }

    /**
     * A long-lived context carrying the configured protocol version and
     * allocator, for the context-taking overloads.
     */
    public ProtocolContext newContext()
    {
        return new ProtocolContext(config.protocolVersion(), allocator);
    }

    // ------------------------------------------------------------------------
    // Create
    // ------------------------------------------------------------------------

    public KmipOutcome<String> create(KmipTransport transport, TemplateAttribute templateAttribute)
    {
        return create(transport, config.maxMessageSize(), templateAttribute);
    }

    public KmipOutcome<String> create(KmipTransport transport, int maxMessageSize, TemplateAttribute templateAttribute)
    {
        try (ProtocolContext context = newContext()) {
            return create(context, transport, maxMessageSize, templateAttribute);
        }
    }

    public KmipOutcome<String> create(ProtocolContext context,
                                      KmipTransport transport,
                                      int maxMessageSize,
                                      TemplateAttribute templateAttribute)
    {
        return orchestrator.execute(context, transport, maxMessageSize, new CreateOperation(templateAttribute));
    }

    // ------------------------------------------------------------------------
    // Destroy
    // ------------------------------------------------------------------------

    public KmipOutcome<Void> destroy(KmipTransport transport, String uniqueIdentifier)
    {
        return destroy(transport, config.maxMessageSize(), uniqueIdentifier);
    }

    public KmipOutcome<Void> destroy(KmipTransport transport, int maxMessageSize, String uniqueIdentifier)
    {
        try (ProtocolContext context = newContext()) {
            return destroy(context, transport, maxMessageSize, uniqueIdentifier);
        }
    }

    public KmipOutcome<Void> destroy(ProtocolContext context,
                                     KmipTransport transport,
                                     int maxMessageSize,
                                     String uniqueIdentifier)
    {
        return orchestrator.execute(context, transport, maxMessageSize, new DestroyOperation(uniqueIdentifier));
    }

    // ------------------------------------------------------------------------
    // Get symmetric key
    // ------------------------------------------------------------------------

    public KmipOutcome<byte[]> getSymmetricKey(KmipTransport transport, String uniqueIdentifier)
    {
        return getSymmetricKey(transport, config.maxMessageSize(), uniqueIdentifier);
    }

    public KmipOutcome<byte[]> getSymmetricKey(KmipTransport transport, int maxMessageSize, String uniqueIdentifier)
    {
        try (ProtocolContext context = newContext()) {
            return getSymmetricKey(context, transport, maxMessageSize, uniqueIdentifier);
        }
    }

    public KmipOutcome<byte[]> getSymmetricKey(ProtocolContext context,
                                               KmipTransport transport,
                                               int maxMessageSize,
                                               String uniqueIdentifier)
    {
        return orchestrator.execute(context, transport, maxMessageSize,
                new GetSymmetricKeyOperation(uniqueIdentifier));
    }

    // ------------------------------------------------------------------------
    // Raw passthrough
    // ------------------------------------------------------------------------

    /**
     * Send already-encoded request bytes and return the complete response
     * frame (8-byte prefix plus declared body) without decoding it.
     */
    public KmipOutcome<byte[]> sendRawRequest(ProtocolContext context,
                                              KmipTransport transport,
                                              int maxMessageSize,
                                              byte[] request)
    {
        return orchestrator.passthrough(context, transport, maxMessageSize, request);
    }

    public KmipOutcome<byte[]> sendRawRequest(KmipTransport transport, byte[] request)
    {
        return sendRawRequest(transport, config.maxMessageSize(), request);
    }

    public KmipOutcome<byte[]> sendRawRequest(KmipTransport transport, int maxMessageSize, byte[] request)
    {
        try (ProtocolContext context = newContext()) {
            return sendRawRequest(context, transport, maxMessageSize, request);
        }
    }

    public static final class Builder
    {
        private KmipClientConfig config = KmipClientConfig.defaults();
        private KmipCodec codec = new DefaultKmipCodec();
        private BufferAllocator allocator = new NettyBufferAllocator();
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private KmipObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        private Builder() {}

        public Builder withConfig(KmipClientConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withCodec(KmipCodec codec)
        {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        public Builder withAllocator(BufferAllocator allocator)
        {
            this.allocator = Objects.requireNonNull(allocator, "allocator");
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder withObservabilitySink(KmipObservabilitySink observabilitySink)
        {
            this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
            return this;
        }

        public KmipClient build()
        {
            return new KmipClient(this);
        }
    }
}
