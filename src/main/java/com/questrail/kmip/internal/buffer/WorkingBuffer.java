package com.questrail.kmip.internal.buffer;

import com.questrail.kmip.transport.KmipTransport;
import io.netty.buffer.ByteBuf;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * WorkingBuffer
 * -----------------------------------------------------------------------------
 * Owned, growable byte region used for one phase of an exchange.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Every byte up to {@link #capacity()} is zero until written; growth
 *       zeroes the added region.</li>
 *   <li>All transfers are bounds-checked against the current capacity.</li>
 *   <li>After {@link #release()} the buffer is unusable; a second release is a no-op.</li>
 * </ul>
 *
 * <p>Not thread-safe. A working buffer belongs to a single in-flight call.</p>
 */
public final class WorkingBuffer
{
    private final BufferAllocator allocator;
    private ByteBuf buf;

    private WorkingBuffer(BufferAllocator allocator, ByteBuf buf)
    {
        this.allocator = allocator;
        this.buf = buf;
    }

    /**
     * Allocate a zero-filled buffer of {@code capacity} bytes.
     *
     * @throws BufferAllocationException if the allocator cannot provide it
     */
    public static WorkingBuffer acquire(BufferAllocator allocator, int capacity)
    {
        Objects.requireNonNull(allocator, "allocator");
        ByteBuf buf = allocator.allocate(capacity);
        if (buf == null) {
            throw new BufferAllocationException("Allocator returned no buffer for " + capacity + " byte(s)");
        }
        return new WorkingBuffer(allocator, buf);
    }

    public int capacity()
    {
        return live().capacity();
    }

    public boolean isReleased()
    {
        return buf == null;
    }

    /**
     * Grow by {@code extraBytes}, preserving contents and zeroing the new region.
     *
     * @throws BufferAllocationException if the allocator cannot provide the memory
     */
    public void grow(int extraBytes)
    {
        if (extraBytes < 0) {
            throw new IllegalArgumentException("extraBytes must be non-negative");
        }
        final ByteBuf current = live();
        final int oldCapacity = current.capacity();
        if (extraBytes > Integer.MAX_VALUE - oldCapacity) {
            throw new BufferAllocationException("Cannot grow " + oldCapacity + " byte buffer by " + extraBytes);
        }
        ByteBuf grown = allocator.reallocate(current, oldCapacity + extraBytes);
        if (grown == null) {
            throw new BufferAllocationException("Allocator returned no buffer when growing to "
                    + (oldCapacity + extraBytes) + " byte(s)");
        }
        buf = grown;
        allocator.zero(grown, oldCapacity, extraBytes);
    }

    /**
     * A {@link ByteBuffer} view of the whole buffer, position 0, limit = capacity.
     * Writes through the view land in this buffer.
     */
    public ByteBuffer view()
    {
        final ByteBuf current = live();
        if (current.hasArray()) {
            return ByteBuffer.wrap(current.array(), current.arrayOffset(), current.capacity()).slice();
        }
        return current.nioBuffer(0, current.capacity());
    }

    /**
     * Write {@code length} bytes starting at {@code offset} to the transport.
     *
     * @return the count reported by the transport
     */
    public int writeTo(KmipTransport transport, int offset, int length) throws IOException
    {
        final ByteBuf current = live();
        Objects.checkFromIndexSize(offset, length, current.capacity());
        if (current.hasArray()) {
            return transport.write(current.array(), current.arrayOffset() + offset, length);
        }
        byte[] copy = new byte[length];
        current.getBytes(offset, copy);
        return transport.write(copy, 0, length);
    }

    /**
     * Read up to {@code length} bytes from the transport into this buffer at {@code offset}.
     *
     * @return the count reported by the transport
     */
    public int readFrom(KmipTransport transport, int offset, int length) throws IOException
    {
        final ByteBuf current = live();
        Objects.checkFromIndexSize(offset, length, current.capacity());
        if (current.hasArray()) {
            return transport.read(current.array(), current.arrayOffset() + offset, length);
        }
        byte[] staging = new byte[length];
        int n = transport.read(staging, 0, length);
        if (n > 0) {
            current.setBytes(offset, staging, 0, Math.min(n, length));
        }
        return n;
    }

    /**
     * Copy bytes into {@code target} without allocating.
     */
    public void getBytes(int offset, byte[] target)
    {
        final ByteBuf current = live();
        Objects.checkFromIndexSize(offset, target.length, current.capacity());
        current.getBytes(offset, target);
    }

    /**
     * Copy a region into a freshly allocated, caller-owned array.
     */
    public byte[] copyOut(int offset, int length)
    {
        final ByteBuf current = live();
        Objects.checkFromIndexSize(offset, length, current.capacity());
        byte[] out = allocator.allocateOutput(length);
        current.getBytes(offset, out, 0, length);
        return out;
    }

    /**
     * Zero and return the memory to the allocator. Idempotent.
     */
    public void release()
    {
        ByteBuf current = buf;
        if (current == null) {
            return;
        }
        buf = null;
        allocator.free(current);
    }

    private ByteBuf live()
    {
        ByteBuf current = buf;
        if (current == null) {
            throw new IllegalStateException("Working buffer already released");
        }
        return current;
    }
}
