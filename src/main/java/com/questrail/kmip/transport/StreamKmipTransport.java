package com.questrail.kmip.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;

/**
 * StreamKmipTransport
 * =============================================================================
 * Blocking {@link KmipTransport} over an {@link InputStream}/{@link OutputStream}
 * pair, typically taken from a connected {@code SSLSocket}.
 *
 * <h2>Read semantics</h2>
 * Reads loop until the requested count has arrived or the stream ends, so a
 * short count from this transport always means end-of-stream. Timeouts come
 * from the underlying socket ({@code SO_TIMEOUT}) and surface as
 * {@link IOException}.
 *
 * <h2>Ownership</h2>
 * {@link #close()} closes both streams, and the socket when built with
 * {@link #over(Socket)}.
 */
public final class StreamKmipTransport implements KmipTransport
{
    private final InputStream in;
    private final OutputStream out;
    private final AutoCloseable owner;

    public StreamKmipTransport(InputStream in, OutputStream out)
    {
        this(in, out, null);
    }

    private StreamKmipTransport(InputStream in, OutputStream out, AutoCloseable owner)
    {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.owner = owner;
    }

    /**
     * Wrap a connected socket. TLS, if any, must already be in place.
     */
    public static StreamKmipTransport over(Socket socket) throws IOException
    {
        Objects.requireNonNull(socket, "socket");
        if (!socket.isConnected()) {
            throw new IllegalArgumentException("Socket must be connected");
        }
        return new StreamKmipTransport(socket.getInputStream(), socket.getOutputStream(), socket);
    }

    @Override
    public int write(byte[] source, int offset, int length) throws IOException
    {
        Objects.checkFromIndexSize(offset, length, source.length);
        out.write(source, offset, length);
        out.flush();
        return length;
    }

    @Override
    public int read(byte[] target, int offset, int length) throws IOException
    {
        Objects.checkFromIndexSize(offset, length, target.length);
        int total = 0;
        while (total < length) {
            int n = in.read(target, offset + total, length - total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    @Override
    public void close() throws IOException
    {
        IOException failure = null;
        try {
            in.close();
        }
        catch (IOException e) {
            failure = e;
        }
        try {
            out.close();
        }
        catch (IOException e) {
            if (failure == null) {
                failure = e;
            }
            else {
                failure.addSuppressed(e);
            }
        }
        if (owner != null) {
            try {
                owner.close();
            }
            catch (Exception e) {
                if (failure == null) {
                    failure = new IOException("Failed to close transport owner", e);
                }
                else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
