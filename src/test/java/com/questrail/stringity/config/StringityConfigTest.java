package com.questrail.stringity.config;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class StringityConfigTest
{
    @Test
    void defaults() {
        StringityConfig config = StringityConfig.defaults();
        assertEquals(StandardCharsets.UTF_16LE, config.compressionCharset());
        assertTrue(config.shuffleSeed().isEmpty());
    }

    @Test
    void builderOverrides() {
        StringityConfig config = StringityConfig.builder()
                .withCompressionCharset(StandardCharsets.UTF_16BE)
                .withShuffleSeed(99L)
                .build();

        assertEquals(StandardCharsets.UTF_16BE, config.compressionCharset());
        assertEquals(99L, config.shuffleSeed().getAsLong());
    }

    @Test
    void narrowCompressionCharsetIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> StringityConfig.builder()
                .withCompressionCharset(StandardCharsets.UTF_8)
                .build());
    }

    @Test
    void nullCompressionCharsetIsRejected() {
        assertThrows(NullPointerException.class, () -> StringityConfig.builder()
                .withCompressionCharset(null)
                .build());
    }
}
