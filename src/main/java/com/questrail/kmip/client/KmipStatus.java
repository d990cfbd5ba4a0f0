package com.questrail.kmip.client;

import com.questrail.kmip.model.ResultStatus;

/**
 * Discriminated status of a single KMIP call.
 *
 * <p>The first four values mirror what the server reported for the batch
 * item. The rest are raised by this client before, during or after the
 * exchange and mean the server's verdict is unknown or unusable.</p>
 */
public enum KmipStatus
{
    SUCCESS,
    OPERATION_FAILED,
    OPERATION_PENDING,
    OPERATION_UNDONE,

    /** The buffer allocator could not provide memory; no further I/O was attempted. */
    MEMORY_ALLOCATION_FAILURE,
    /** The transport failed or transferred fewer bytes than requested. */
    IO_FAILURE,
    /** The server declared a body longer than the caller's maximum; the body was not read. */
    EXCEEDS_MAX_MESSAGE_SIZE,
    /** The codec failed for a reason other than running out of buffer space. */
    ENCODING_ERROR,
    /** The received bytes did not decode into a response message. */
    DECODING_ERROR,
    /** The response decoded but did not hold exactly one batch item. */
    MALFORMED_RESPONSE,
    /** The returned object's type, key format or wrapping did not match the request. */
    OBJECT_MISMATCH;

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /**
     * True when the status was reported by the server rather than raised locally.
     */
    public boolean isServerResult() {
        return switch (this) {
            case SUCCESS, OPERATION_FAILED, OPERATION_PENDING, OPERATION_UNDONE -> true;
            default -> false;
        };
    }

    public static KmipStatus of(ResultStatus status) {
        return switch (status) {
            case SUCCESS -> SUCCESS;
            case OPERATION_FAILED -> OPERATION_FAILED;
            case OPERATION_PENDING -> OPERATION_PENDING;
            case OPERATION_UNDONE -> OPERATION_UNDONE;
        };
    }
}
