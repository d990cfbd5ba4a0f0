package com.questrail.kmip.codec;

/**
 * KmipFraming
 * -----------------------------------------------------------------------------
 * Frame-level constants and the length-field reader.
 *
 * <p>Every KMIP message on the wire starts with an 8-byte prefix:</p>
 * <pre>
 *   bytes 0..3  outer tag and item type (opaque to the exchange engine)
 *   bytes 4..7  big-endian signed 32-bit body length
 * </pre>
 *
 * <p>The full frame is {@code HEADER_WIDTH + bodyLength} bytes.</p>
 */
public final class KmipFraming
{
    /** Width of the fixed frame prefix. */
    public static final int HEADER_WIDTH = 8;

    /** Offset of the body-length field inside the prefix. */
    public static final int LENGTH_OFFSET = 4;

    private KmipFraming() {}

    /**
     * Reads the declared body length from a frame prefix.
     *
     * <p>The value is interpreted as signed; a negative result is returned
     * as-is and left for the caller to reject.</p>
     *
     * @param header at least {@link #HEADER_WIDTH} bytes starting at {@code offset}
     * @param offset position of the first prefix byte
     * @return the declared body length
     */
    public static int readBodyLength(byte[] header, int offset) {
        if (header == null || offset < 0 || header.length - offset < HEADER_WIDTH) {
            throw new IllegalArgumentException("Frame prefix requires " + HEADER_WIDTH + " bytes");
        }
        int p = offset + LENGTH_OFFSET;
        return ((header[p] & 0xFF) << 24)
                | ((header[p + 1] & 0xFF) << 16)
                | ((header[p + 2] & 0xFF) << 8)
                | (header[p + 3] & 0xFF);
    }
}
