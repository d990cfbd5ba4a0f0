package com.questrail.kmip.config;

import com.questrail.kmip.model.ProtocolVersion;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class KmipClientConfigTest
{
    @Test
    void defaults()
    {
        KmipClientConfig config = KmipClientConfig.defaults();
        assertEquals(ProtocolVersion.KMIP_1_0, config.protocolVersion());
        assertEquals(8192, config.maxMessageSize());
        assertEquals(1024, config.encodeBlockSize());
    }

    @Test
    void builderOverrides()
    {
        KmipClientConfig config = KmipClientConfig.builder()
                .withProtocolVersion(ProtocolVersion.KMIP_1_4)
                .withMaxMessageSize(65536)
                .withEncodeBlockSize(4096)
                .build();

        assertEquals(ProtocolVersion.KMIP_1_4, config.protocolVersion());
        assertEquals(65536, config.maxMessageSize());
        assertEquals(4096, config.encodeBlockSize());
    }

    @Test
    void rejectsInvalidValues()
    {
        assertThrows(IllegalArgumentException.class,
                () -> KmipClientConfig.builder().withMaxMessageSize(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> KmipClientConfig.builder().withMaxMessageSize(Integer.MAX_VALUE).build());
        assertThrows(IllegalArgumentException.class,
                () -> KmipClientConfig.builder().withEncodeBlockSize(-1).build());
        assertThrows(NullPointerException.class,
                () -> KmipClientConfig.builder().withProtocolVersion(null).build());
    }

    @Test
    void largestAcceptedMaximumLeavesRoomForThePrefix()
    {
        KmipClientConfig config = KmipClientConfig.builder().withMaxMessageSize(Integer.MAX_VALUE - 8).build();
        assertEquals(Integer.MAX_VALUE - 8, config.maxMessageSize());
    }
}
