package com.questrail.kmip.internal.buffer;

/**
 * Raised by a {@link BufferAllocator} that cannot provide the requested memory.
 */
public final class BufferAllocationException extends RuntimeException
{
    public BufferAllocationException(String message) {
        super(message);
    }

    public BufferAllocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
