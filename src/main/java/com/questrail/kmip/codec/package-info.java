/**
 * KMIP Codec Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> contract used by the
 * exchange engine, and the frame prefix rules that the engine applies before
 * any bytes reach the codec.</p>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec sits <strong>below</strong> operation semantics and
 * <strong>beside</strong> transport I/O:</p>
 *
 * <pre>
 *   RequestMessage
 *        → KmipCodec.encodeRequest   (into the engine's working buffer)
 *            → KmipTransport.write
 *
 *   KmipTransport.read (8-byte prefix, then declared body)
 *        → KmipCodec.decodeResponse
 *            → ResponseMessage
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The engine reads only the length field of the prefix
 *       ({@link com.questrail.kmip.codec.KmipFraming}); the first four bytes
 *       belong to the codec.</li>
 *   <li>"Buffer too small" is a normal encode outcome, not an error; the
 *       engine grows its buffer and retries.</li>
 *   <li>Response shape (batch count, single item) is checked by the engine,
 *       never by the codec.</li>
 * </ul>
 *
 * <p>{@code com.questrail.kmip.codec.impl} provides the default TTLV codec.</p>
 */
package com.questrail.kmip.codec;
