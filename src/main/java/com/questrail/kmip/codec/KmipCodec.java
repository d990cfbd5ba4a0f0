package com.questrail.kmip.codec;

import com.questrail.kmip.model.RequestMessage;
import com.questrail.kmip.model.ResponseMessage;

import java.nio.ByteBuffer;

/**
 * KmipCodec
 * -----------------------------------------------------------------------------
 * Structural codec between typed KMIP messages and their on-wire encoding.
 *
 * <p>This interface is the boundary the exchange engine relies on. The engine
 * owns buffers, framing and I/O; the codec owns tags, item types and layout.</p>
 *
 * <p>The codec is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Allocating or growing buffers</li>
 *   <li>Reading or writing the transport</li>
 *   <li>Validating response shape (batch count, item presence)</li>
 * </ul>
 *
 * <p>Implementations must be stateless or otherwise safe to share between
 * protocol contexts.</p>
 */
public interface KmipCodec
{
    /**
     * Encode a request into {@code target}, starting at its current position.
     *
     * <p>When the encoding does not fit in the remaining space, the codec
     * returns {@link EncodeResult.BufferTooSmall}; the contents of
     * {@code target} are then unspecified and the caller is expected to retry
     * with a larger buffer.</p>
     *
     * @param request the message to encode
     * @param target  destination with a fixed capacity
     * @return the outcome of the attempt
     */
    EncodeResult encodeRequest(RequestMessage request, ByteBuffer target);

    /**
     * Decode one complete response frame.
     *
     * @param frame the frame bytes from position to limit, header included
     * @return the decoded response
     * @throws KmipDecodeException if the bytes do not form a valid response message
     */
    ResponseMessage decodeResponse(ByteBuffer frame);
}
