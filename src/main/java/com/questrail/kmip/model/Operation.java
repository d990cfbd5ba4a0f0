package com.questrail.kmip.model;

import java.util.Optional;

/**
 * KMIP operations issued by this client.
 */
public enum Operation
{
    CREATE(0x01),
    GET(0x0A),
    DESTROY(0x14);

    private final int code;

    Operation(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<Operation> fromCode(int code) {
        for (Operation op : values()) {
            if (op.code == code) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
