package com.questrail.kmip.internal.exchange;

import com.questrail.kmip.client.KmipStatus;
import com.questrail.kmip.codec.EncodeResult;
import com.questrail.kmip.codec.KmipCodec;
import com.questrail.kmip.internal.buffer.WorkingBuffer;
import com.questrail.kmip.model.RequestMessage;
import com.questrail.kmip.transport.KmipTransport;

import java.io.IOException;
import java.util.Objects;

/**
 * FrameTransmitter
 * -----------------------------------------------------------------------------
 * Encodes a request into the context's working buffer and writes it out.
 *
 * <h2>Encode-retry loop</h2>
 * <p>The first attempt uses one block. Each time the codec reports that the
 * encoding does not fit, the buffer is discarded and a new one, one block
 * larger, is acquired. The loop has no iteration cap: it ends when the codec
 * succeeds, fails for another reason, or the allocator runs out. A codec that
 * never fits will therefore consume memory until allocation fails.</p>
 *
 * <h2>Buffer ownership</h2>
 * <p>The buffer is released as soon as the write succeeds. On any failure it
 * is left with the context; the orchestrator releases it.</p>
 */
public final class FrameTransmitter
{
    private final KmipCodec codec;
    private final int blockSize;

    public FrameTransmitter(KmipCodec codec, int blockSize)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize must be positive");
        }
        this.blockSize = blockSize;
    }

    /**
     * Encode and send {@code request}.
     *
     * @return the number of bytes written
     */
    public int send(ProtocolContext context, KmipTransport transport, RequestMessage request)
            throws ExchangeException
    {
        Objects.requireNonNull(request, "request");

        int blocks = 1;
        WorkingBuffer buffer = context.acquire(blockSize);
        EncodeResult result = encode(request, buffer);

        while (result instanceof EncodeResult.BufferTooSmall) {
            context.release();
            blocks++;
            long size = (long) blocks * blockSize;
            if (size > Integer.MAX_VALUE) {
                throw new ExchangeException(KmipStatus.MEMORY_ALLOCATION_FAILURE,
                        "Encoding buffer would exceed " + Integer.MAX_VALUE + " bytes");
            }
            buffer = context.acquire((int) size);
            result = encode(request, buffer);
        }

        if (result instanceof EncodeResult.Failed failed) {
            throw new ExchangeException(KmipStatus.ENCODING_ERROR, failed.reason());
        }

        final int length = ((EncodeResult.Encoded) result).length();
        if (length > buffer.capacity()) {
            throw new ExchangeException(KmipStatus.ENCODING_ERROR,
                    "Codec reported " + length + " bytes for a " + buffer.capacity() + " byte buffer");
        }

        final int sent;
        try {
            sent = buffer.writeTo(transport, 0, length);
        }
        catch (IOException e) {
            throw new ExchangeException(KmipStatus.IO_FAILURE, "Request write failed: " + e.getMessage(), e);
        }
        if (sent != length) {
            throw new ExchangeException(KmipStatus.IO_FAILURE,
                    "Short write: " + sent + " of " + length + " byte(s)");
        }

        context.release();
        return length;
    }

    /**
     * Send caller-encoded request bytes as-is, without touching the codec or
     * the working buffer.
     *
     * @return the number of bytes written
     */
    public int sendEncoded(KmipTransport transport, byte[] request) throws ExchangeException
    {
        Objects.requireNonNull(request, "request");

        final int sent;
        try {
            sent = transport.write(request, 0, request.length);
        }
        catch (IOException e) {
            throw new ExchangeException(KmipStatus.IO_FAILURE, "Request write failed: " + e.getMessage(), e);
        }
        if (sent != request.length) {
            throw new ExchangeException(KmipStatus.IO_FAILURE,
                    "Short write: " + sent + " of " + request.length + " byte(s)");
        }
        return sent;
    }

    private EncodeResult encode(RequestMessage request, WorkingBuffer buffer) throws ExchangeException
    {
        final EncodeResult result;
        try {
            result = codec.encodeRequest(request, buffer.view());
        }
        catch (RuntimeException e) {
            throw new ExchangeException(KmipStatus.ENCODING_ERROR, "Codec failed: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new ExchangeException(KmipStatus.ENCODING_ERROR, "Codec returned no result");
        }
        return result;
    }
}
