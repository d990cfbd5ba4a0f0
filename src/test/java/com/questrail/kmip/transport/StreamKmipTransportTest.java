package com.questrail.kmip.transport;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

import static org.junit.jupiter.api.Assertions.*;

final class StreamKmipTransportTest
{
    @Test
    void readLoopsOverPartialStreamReads() throws Exception
    {
        InputStream trickle = new OneByteAtATime(new ByteArrayInputStream(new byte[] { 1, 2, 3, 4, 5 }));
        StreamKmipTransport transport = new StreamKmipTransport(trickle, new ByteArrayOutputStream());

        byte[] target = new byte[6];
        assertEquals(4, transport.read(target, 1, 4));
        assertArrayEquals(new byte[] { 0, 1, 2, 3, 4, 0 }, target);
    }

    @Test
    void shortCountMeansEndOfStream() throws Exception
    {
        StreamKmipTransport transport = new StreamKmipTransport(
                new ByteArrayInputStream(new byte[] { 9, 9, 9 }), new ByteArrayOutputStream());

        assertEquals(3, transport.read(new byte[8], 0, 8));
        assertEquals(0, transport.read(new byte[8], 0, 8));
    }

    @Test
    void writeSendsEverythingAndFlushes() throws Exception
    {
        FlushTracking out = new FlushTracking();
        StreamKmipTransport transport = new StreamKmipTransport(new ByteArrayInputStream(new byte[0]), out);

        assertEquals(3, transport.write(new byte[] { 7, 8, 9, 10 }, 1, 3));
        assertArrayEquals(new byte[] { 8, 9, 10 }, out.toByteArray());
        assertTrue(out.flushed);
    }

    @Test
    void writeFailurePropagates()
    {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("broken pipe");
            }
        };
        StreamKmipTransport transport = new StreamKmipTransport(new ByteArrayInputStream(new byte[0]), broken);

        assertThrows(IOException.class, () -> transport.write(new byte[4], 0, 4));
    }

    @Test
    void closeClosesBothStreamsAndKeepsFirstFailure()
    {
        InputStream in = new InputStream() {
            @Override
            public int read() {
                return -1;
            }

            @Override
            public void close() throws IOException {
                throw new IOException("in");
            }
        };
        OutputStream out = new OutputStream() {
            @Override
            public void write(int b) {
            }

            @Override
            public void close() throws IOException {
                throw new IOException("out");
            }
        };

        IOException e = assertThrows(IOException.class, () -> new StreamKmipTransport(in, out).close());
        assertEquals("in", e.getMessage());
        assertEquals("out", e.getSuppressed()[0].getMessage());
    }

    @Test
    void rejectsUnconnectedSocket()
    {
        assertThrows(IllegalArgumentException.class, () -> StreamKmipTransport.over(new Socket()));
    }

    private static final class OneByteAtATime extends FilterInputStream
    {
        OneByteAtATime(InputStream in) {
            super(in);
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return super.read(b, off, Math.min(len, 1));
        }
    }

    private static final class FlushTracking extends ByteArrayOutputStream
    {
        boolean flushed;

        @Override
        public void flush() {
            flushed = true;
        }
    }
}
