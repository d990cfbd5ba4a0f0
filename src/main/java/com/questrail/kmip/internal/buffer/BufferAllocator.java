package com.questrail.kmip.internal.buffer;

import io.netty.buffer.ByteBuf;

/**
 * BufferAllocator
 * -----------------------------------------------------------------------------
 * Injectable allocation strategy behind every {@link WorkingBuffer}.
 *
 * <p>A strategy instance may be shared read-only across protocol contexts;
 * each buffer it returns is owned by exactly one context at a time.</p>
 *
 * <p>Any method that obtains memory reports exhaustion by throwing
 * {@link BufferAllocationException}; the exchange engine turns that into a
 * memory-allocation outcome and performs no further I/O.</p>
 */
public interface BufferAllocator
{
    /**
     * Allocate a buffer of exactly {@code capacity} bytes, all zero.
     */
    ByteBuf allocate(int capacity);

    /**
     * Resize {@code buffer} to {@code newCapacity}, preserving its existing
     * contents. May return the same instance. The newly added region is not
     * guaranteed to be zero; callers use {@link #zero}.
     */
    ByteBuf reallocate(ByteBuf buffer, int newCapacity);

    /**
     * Overwrite {@code length} bytes starting at {@code index} with zeros.
     */
    void zero(ByteBuf buffer, int index, int length);

    /**
     * Return {@code buffer} to the strategy. The buffer must not be used afterwards.
     */
    void free(ByteBuf buffer);

    /**
     * Allocate a caller-owned output array of {@code length} bytes.
     */
    byte[] allocateOutput(int length);
}
