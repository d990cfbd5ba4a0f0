package com.questrail.kmip.internal.exchange;

import com.questrail.kmip.client.KmipStatus;
import com.questrail.kmip.internal.buffer.BufferAllocationException;
import com.questrail.kmip.internal.buffer.BufferAllocator;
import com.questrail.kmip.internal.buffer.WorkingBuffer;
import com.questrail.kmip.model.ProtocolVersion;

import java.util.Objects;

/**
 * ProtocolContext
 * =============================================================================
 * Per-call (or long-lived, pre-configured) state of the exchange engine: the
 * protocol version, the allocation strategy and the single working buffer.
 *
 * <h2>Ownership</h2>
 * <ul>
 *   <li>At most one working buffer is held at any time. Acquiring a second
 *       while one is held is a programming error.</li>
 *   <li>{@link #release()} nulls the handle before freeing, so releasing an
 *       empty context is a no-op. Every exit of an exchange ends with the
 *       context empty.</li>
 *   <li>Allocation failures surface as
 *       {@link KmipStatus#MEMORY_ALLOCATION_FAILURE}.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Not thread-safe. Sharing one context between concurrent calls requires
 * external locking by the caller. The allocator itself may be shared.
 */
public final class ProtocolContext implements AutoCloseable
{
    private final ProtocolVersion version;
    private final BufferAllocator allocator;

    private WorkingBuffer buffer;

    public ProtocolContext(ProtocolVersion version, BufferAllocator allocator)
    {
        this.version = Objects.requireNonNull(version, "version");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    public ProtocolVersion version()
    {
        return version;
    }

    public boolean holdsBuffer()
    {
        return buffer != null;
    }

    /**
     * Acquire a zero-filled working buffer of {@code capacity} bytes.
     */
    public WorkingBuffer acquire(int capacity) throws ExchangeException
    {
        if (buffer != null) {
            throw new IllegalStateException("Context already holds a working buffer");
        }
        try {
            buffer = WorkingBuffer.acquire(allocator, capacity);
        }
        catch (BufferAllocationException e) {
            throw new ExchangeException(KmipStatus.MEMORY_ALLOCATION_FAILURE, e.getMessage(), e);
        }
        return buffer;
    }

    /**
     * The held working buffer.
     */
    public WorkingBuffer working()
    {
        if (buffer == null) {
            throw new IllegalStateException("Context holds no working buffer");
        }
        return buffer;
    }

    /**
     * Grow the held buffer by {@code extraBytes}; the added region is zero.
     */
    public void grow(int extraBytes) throws ExchangeException
    {
        WorkingBuffer current = working();
        try {
            current.grow(extraBytes);
        }
        catch (BufferAllocationException e) {
            throw new ExchangeException(KmipStatus.MEMORY_ALLOCATION_FAILURE, e.getMessage(), e);
        }
    }

    /**
     * Allocate a caller-owned output array through the context's allocator.
     */
    public byte[] allocateOutput(int length) throws ExchangeException
    {
        try {
            return allocator.allocateOutput(length);
        }
        catch (BufferAllocationException e) {
            throw new ExchangeException(KmipStatus.MEMORY_ALLOCATION_FAILURE, e.getMessage(), e);
        }
    }

    /**
     * Copy a region of the held buffer into a caller-owned array.
     */
    public byte[] copyOut(int offset, int length) throws ExchangeException
    {
        WorkingBuffer current = working();
        try {
            return current.copyOut(offset, length);
        }
        catch (BufferAllocationException e) {
            throw new ExchangeException(KmipStatus.MEMORY_ALLOCATION_FAILURE, e.getMessage(), e);
        }
    }

    /**
     * Release the held buffer, if any, and reset the handle.
     */
    public void release()
    {
        WorkingBuffer current = buffer;
        buffer = null;
        if (current != null) {
            current.release();
        }
    }

    @Override
    public void close()
    {
        release();
    }
}
