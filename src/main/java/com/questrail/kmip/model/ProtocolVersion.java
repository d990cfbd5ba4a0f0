package com.questrail.kmip.model;

/**
 * KMIP protocol version carried in every request and response header.
 *
 * <p>The client never negotiates: the version is fixed per client (or per
 * pre-configured context) and sent as-is.</p>
 */
public record ProtocolVersion(int major, int minor)
{
    public static final ProtocolVersion KMIP_1_0 = new ProtocolVersion(1, 0);
    public static final ProtocolVersion KMIP_1_1 = new ProtocolVersion(1, 1);
    public static final ProtocolVersion KMIP_1_2 = new ProtocolVersion(1, 2);
    public static final ProtocolVersion KMIP_1_3 = new ProtocolVersion(1, 3);
    public static final ProtocolVersion KMIP_1_4 = new ProtocolVersion(1, 4);

    public ProtocolVersion {
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("Protocol version components must be non-negative");
        }
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
