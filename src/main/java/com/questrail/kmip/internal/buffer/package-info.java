/**
 * Buffer Lifecycle
 * =============================================================================
 *
 * <p>Allocation, growth, zeroing and release of the single working buffer a
 * protocol context holds during an exchange.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty {@code ByteBuf} appears only in the {@link
 * com.questrail.kmip.internal.buffer.BufferAllocator} strategy signature and
 * inside {@link com.questrail.kmip.internal.buffer.WorkingBuffer}. Nothing
 * outside this package touches a {@code ByteBuf} directly.
 */
package com.questrail.kmip.internal.buffer;
