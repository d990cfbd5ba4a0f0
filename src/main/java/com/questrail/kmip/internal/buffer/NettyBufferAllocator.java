package com.questrail.kmip.internal.buffer;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.UnpooledByteBufAllocator;

import java.util.Objects;

/**
 * NettyBufferAllocator
 * =============================================================================
 * Default {@link BufferAllocator} backed by a Netty {@link ByteBufAllocator}.
 *
 * <h2>Zeroing</h2>
 * Buffers are zeroed on allocation and again before they are released, so
 * encoded requests and received responses (which may hold key material) do
 * not linger in memory handed back to the allocator.
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape {@code internal.buffer}: the exchange engine sees
 * only {@link WorkingBuffer}, {@code byte[]} and {@code java.nio} views.
 */
public final class NettyBufferAllocator implements BufferAllocator
{
    private final ByteBufAllocator delegate;

    /**
     * Unpooled heap buffers.
     */
    public NettyBufferAllocator()
    {
        this(UnpooledByteBufAllocator.DEFAULT);
    }

    public NettyBufferAllocator(ByteBufAllocator delegate)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public ByteBuf allocate(int capacity)
    {
        requireNonNegative(capacity);
        final ByteBuf buf;
        try {
            buf = delegate.heapBuffer(capacity, Integer.MAX_VALUE);
        }
        catch (OutOfMemoryError e) {
            throw new BufferAllocationException("Cannot allocate " + capacity + " byte(s)", e);
        }
        if (buf.capacity() != capacity) {
            buf.capacity(capacity);
        }
        buf.setZero(0, capacity);
        return buf;
    }

    @Override
    public ByteBuf reallocate(ByteBuf buffer, int newCapacity)
    {
        Objects.requireNonNull(buffer, "buffer");
        requireNonNegative(newCapacity);
        try {
            return buffer.capacity(newCapacity);
        }
        catch (OutOfMemoryError e) {
            throw new BufferAllocationException("Cannot grow buffer to " + newCapacity + " byte(s)", e);
        }
    }

    @Override
    public void zero(ByteBuf buffer, int index, int length)
    {
        buffer.setZero(index, length);
    }

    @Override
    public void free(ByteBuf buffer)
    {
        Objects.requireNonNull(buffer, "buffer");
        buffer.setZero(0, buffer.capacity());
        buffer.release();
    }

    @Override
    public byte[] allocateOutput(int length)
    {
        requireNonNegative(length);
        try {
            return new byte[length];
        }
        catch (OutOfMemoryError e) {
            throw new BufferAllocationException("Cannot allocate " + length + " byte output", e);
        }
    }

    private static void requireNonNegative(int capacity)
    {
        if (capacity < 0) {
            throw new BufferAllocationException("Negative capacity: " + capacity);
        }
    }
}
