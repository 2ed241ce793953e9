package com.questrail.stringity.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Tunable policy for the {@code Stringity} facade.
 *
 * <ul>
 *   <li><b>compressionCharset</b>: wide charset the compression codec serializes
 *       text with before GZIP. Must be two bytes per UTF-16 code unit
 *       (UTF-16LE or UTF-16BE). Default UTF-16LE.</li>
 *   <li><b>shuffleSeed</b>: when present, the facade's shuffle draws from a
 *       generator seeded with this value and is reproducible. Default empty.</li>
 * </ul>
 */
public record StringityConfig(
    Charset compressionCharset,
    OptionalLong shuffleSeed
) {
    public StringityConfig {
        Objects.requireNonNull(compressionCharset, "compressionCharset");
        Objects.requireNonNull(shuffleSeed, "shuffleSeed");

        if (!compressionCharset.equals(StandardCharsets.UTF_16LE)
                && !compressionCharset.equals(StandardCharsets.UTF_16BE)) {
            throw new IllegalArgumentException(
                "compressionCharset must be UTF-16LE or UTF-16BE: " + compressionCharset.name());
        }
    }

    public static StringityConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Charset compressionCharset = StandardCharsets.UTF_16LE;
        private OptionalLong shuffleSeed = OptionalLong.empty();

        public Builder withCompressionCharset(Charset compressionCharset) {
            this.compressionCharset = compressionCharset;
            return this;
        }

        public Builder withShuffleSeed(long seed) {
            this.shuffleSeed = OptionalLong.of(seed);
            return this;
        }

        public Builder withoutShuffleSeed() {
            this.shuffleSeed = OptionalLong.empty();
            return this;
        }

        public StringityConfig build() {
            return new StringityConfig(compressionCharset, shuffleSeed);
        }
    }
}
