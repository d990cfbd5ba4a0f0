package com.questrail.kmip.model;

/**
 * KMIP Name Type enumeration.
 */
public enum NameType
{
    UNINTERPRETED_TEXT_STRING(0x01),
    URI(0x02);

    private final int code;

    NameType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
