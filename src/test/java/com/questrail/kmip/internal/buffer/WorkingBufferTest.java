package com.questrail.kmip.internal.buffer;

import com.questrail.kmip.transport.ScriptedTransport;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class WorkingBufferTest
{
    private final CountingBufferAllocator allocator = new CountingBufferAllocator();

    @Test
    void acquiredBufferIsZeroFilled()
    {
        WorkingBuffer buffer = WorkingBuffer.acquire(allocator, 16);

        byte[] contents = new byte[16];
        buffer.getBytes(0, contents);
        assertArrayEquals(new byte[16], contents);
        assertEquals(16, buffer.capacity());

        buffer.release();
    }

    @Test
    void growPreservesContentsAndZeroesNewRegion()
    {
        WorkingBuffer buffer = WorkingBuffer.acquire(allocator, 8);
        ByteBuffer view = buffer.view();
        for (int i = 0; i < 8; i++) {
            view.put((byte) (i + 1));
        }

        buffer.grow(8);

        assertEquals(16, buffer.capacity());
        byte[] contents = new byte[16];
        buffer.getBytes(0, contents);
        assertArrayEquals(new byte[] { 1, 2, 3, 4, 5, 6, 7, 8, 0, 0, 0, 0, 0, 0, 0, 0 }, contents);
        assertEquals(1, allocator.reallocations().size());

        buffer.release();
    }

    @Test
    void viewWritesLandInTheBuffer()
    {
        WorkingBuffer buffer = WorkingBuffer.acquire(allocator, 4);
        ByteBuffer view = buffer.view();
        assertEquals(0, view.position());
        assertEquals(4, view.limit());

        view.putInt(0xCAFEBABE);

        assertArrayEquals(new byte[] { (byte) 0xCA, (byte) 0xFE, (byte) 0xBA, (byte) 0xBE }, buffer.copyOut(0, 4));
        buffer.release();
    }

    @Test
    void transfersGoThroughTheTransport() throws Exception
    {
        ScriptedTransport transport = new ScriptedTransport().respondWith(new byte[] { 7, 8, 9 });
        WorkingBuffer buffer = WorkingBuffer.acquire(allocator, 6);

        assertEquals(3, buffer.readFrom(transport, 2, 3));
        assertEquals(4, buffer.writeTo(transport, 1, 4));
        assertArrayEquals(new byte[] { 0, 7, 8, 9 }, transport.written());

        buffer.release();
    }

    @Test
    void transfersAreBoundsChecked()
    {
        WorkingBuffer buffer = WorkingBuffer.acquire(allocator, 8);
        ScriptedTransport transport = new ScriptedTransport();

        assertThrows(IndexOutOfBoundsException.class, () -> buffer.readFrom(transport, 4, 8));
        assertThrows(IndexOutOfBoundsException.class, () -> buffer.writeTo(transport, -1, 2));
        assertThrows(IndexOutOfBoundsException.class, () -> buffer.copyOut(0, 9));

        buffer.release();
    }

    @Test
    void releaseIsIdempotentAndDisablesTheBuffer()
    {
        WorkingBuffer buffer = WorkingBuffer.acquire(allocator, 8);
        buffer.release();
        buffer.release();

        assertTrue(buffer.isReleased());
        assertEquals(1, allocator.freeCount());
        assertEquals(0, allocator.outstanding());
        assertThrows(IllegalStateException.class, buffer::capacity);
    }

    @Test
    void copyOutUsesTheOutputAllocator()
    {
        WorkingBuffer buffer = WorkingBuffer.acquire(allocator, 8);
        buffer.copyOut(2, 5);
        assertEquals(List.of(5), allocator.outputs());
        buffer.release();
    }

    @Test
    void growBeyondIntRangeFailsAsAllocation()
    {
        WorkingBuffer buffer = WorkingBuffer.acquire(allocator, 8);
        assertThrows(BufferAllocationException.class, () -> buffer.grow(Integer.MAX_VALUE));
        buffer.release();
    }
}
