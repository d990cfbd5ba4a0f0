package com.questrail.kmip.transport;

import java.io.IOException;

/**
 * KmipTransport
 * -----------------------------------------------------------------------------
 * Minimal port for the established, bidirectional byte stream to a KMIP server.
 *
 * <p>The stream is assumed to be already authenticated and encrypted (for
 * example an open TLS session). This port performs no handshake and carries
 * no protocol meaning.</p>
 *
 * <p>Neither call is required to transfer the full amount requested. The
 * exchange engine compares every returned count with what it asked for and
 * treats any shortfall as an I/O failure.</p>
 *
 * <p>Blocking behavior, timeouts and cancellation are the implementation's
 * concern; the exchange engine enforces none.</p>
 */
public interface KmipTransport extends AutoCloseable
{
    /**
     * Write bytes to the server.
     *
     * @return the number of bytes actually written
     * @throws IOException if the stream failed
     */
    int write(byte[] source, int offset, int length) throws IOException;

    /**
     * Read bytes from the server into {@code target}.
     *
     * @return the number of bytes actually read; fewer than {@code length}
     *         (including zero or a negative value) signals the stream ended
     * @throws IOException if the stream failed
     */
    int read(byte[] target, int offset, int length) throws IOException;

    @Override
    void close() throws IOException;
}
