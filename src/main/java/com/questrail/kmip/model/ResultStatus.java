package com.questrail.kmip.model;

import java.util.Optional;

/**
 * Result status reported by the server for a single batch item.
 */
public enum ResultStatus
{
    SUCCESS(0x00),
    OPERATION_FAILED(0x01),
    OPERATION_PENDING(0x02),
    OPERATION_UNDONE(0x03);

    private final int code;

    ResultStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<ResultStatus> fromCode(int code) {
        for (ResultStatus s : values()) {
            if (s.code == code) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
