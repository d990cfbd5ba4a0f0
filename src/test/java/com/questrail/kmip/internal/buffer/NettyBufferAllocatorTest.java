package com.questrail.kmip.internal.buffer;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.UnpooledByteBufAllocator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class NettyBufferAllocatorTest
{
    private final NettyBufferAllocator allocator = new NettyBufferAllocator(new UnpooledByteBufAllocator(false));

    @Test
    void allocatesExactZeroedHeapBuffer()
    {
        ByteBuf buf = allocator.allocate(1024);
        try {
            assertEquals(1024, buf.capacity());
            assertTrue(buf.hasArray());
            for (int i = 0; i < buf.capacity(); i++) {
                assertEquals(0, buf.getByte(i));
            }
        }
        finally {
            allocator.free(buf);
        }
    }

    @Test
    void reallocatePreservesContents()
    {
        ByteBuf buf = allocator.allocate(4);
        buf.setInt(0, 0x01020304);

        ByteBuf grown = allocator.reallocate(buf, 12);
        assertEquals(12, grown.capacity());
        assertEquals(0x01020304, grown.getInt(0));

        allocator.free(grown);
    }

    @Test
    void freeZeroesAndReleases()
    {
        ByteBuf buf = allocator.allocate(8);
        buf.setLong(0, -1L);
        byte[] backing = buf.array();

        allocator.free(buf);

        assertEquals(0, buf.refCnt());
        assertArrayEquals(new byte[8], backing);
    }

    @Test
    void negativeCapacityIsAnAllocationFailure()
    {
        assertThrows(BufferAllocationException.class, () -> allocator.allocate(-1));
        assertThrows(BufferAllocationException.class, () -> allocator.allocateOutput(-1));
    }

    @Test
    void outputArraysAreCallerOwned()
    {
        byte[] a = allocator.allocateOutput(16);
        byte[] b = allocator.allocateOutput(16);
        assertNotSame(a, b);
        assertArrayEquals(new byte[16], a);
    }
}
