package com.questrail.kmip.internal.exchange;

import com.questrail.kmip.client.KmipStatus;
import com.questrail.kmip.codec.KmipFraming;
import com.questrail.kmip.internal.buffer.WorkingBuffer;
import com.questrail.kmip.transport.KmipTransport;

import java.io.IOException;
import java.util.Arrays;

/**
 * FrameReceiver
 * -----------------------------------------------------------------------------
 * Reads one length-prefixed response frame into the context's working buffer.
 *
 * <ol>
 *   <li>Acquire an {@value KmipFraming#HEADER_WIDTH}-byte buffer and read the
 *       prefix. A short read is an I/O failure.</li>
 *   <li>Parse the declared body length. A length above the caller's maximum
 *       is rejected <em>before</em> anything else is allocated or read.</li>
 *   <li>Grow the buffer by the declared length (the new region is zeroed) and
 *       read exactly that many bytes after the prefix.</li>
 * </ol>
 *
 * <p>On success the context still holds the buffer, sized
 * {@code HEADER_WIDTH + declaredLength}. On failure the buffer is left with
 * the context for the orchestrator to release.</p>
 */
public final class FrameReceiver
{
    public WorkingBuffer receive(ProtocolContext context, KmipTransport transport, int maxMessageSize)
            throws ExchangeException
    {
        WorkingBuffer buffer = context.acquire(KmipFraming.HEADER_WIDTH);
        readExactly(buffer, transport, 0, KmipFraming.HEADER_WIDTH, "header");

        byte[] prefix = new byte[KmipFraming.HEADER_WIDTH];
        buffer.getBytes(0, prefix);
        final int declared = KmipFraming.readBodyLength(prefix, 0);
        Arrays.fill(prefix, (byte) 0);

        if (declared < 0) {
            throw new ExchangeException(KmipStatus.DECODING_ERROR,
                    "Server declared a negative body length: " + declared);
        }
        if (declared > maxMessageSize) {
            throw new ExchangeException(KmipStatus.EXCEEDS_MAX_MESSAGE_SIZE,
                    "Server declared " + declared + " byte(s), maximum is " + maxMessageSize);
        }

        context.grow(declared);
        if (declared > 0) {
            readExactly(buffer, transport, KmipFraming.HEADER_WIDTH, declared, "body");
        }
        return buffer;
    }

    private static void readExactly(WorkingBuffer buffer, KmipTransport transport, int offset, int length, String part)
            throws ExchangeException
    {
        final int received;
        try {
            received = buffer.readFrom(transport, offset, length);
        }
        catch (IOException e) {
            throw new ExchangeException(KmipStatus.IO_FAILURE,
                    "Response " + part + " read failed: " + e.getMessage(), e);
        }
        if (received != length) {
            throw new ExchangeException(KmipStatus.IO_FAILURE,
                    "Short " + part + " read: " + Math.max(received, 0) + " of " + length + " byte(s)");
        }
    }
}
