package com.questrail.stringity.codec;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * TextEncoding
 * -----------------------------------------------------------------------------
 * The fixed set of byte encodings the library re-encodes through.
 *
 * <p>{@link #roundTrip(String)} encodes the text to bytes and immediately
 * decodes them again with the JDK's standard replacement policy. On input the
 * encoding can represent, the result equals the input. Otherwise each
 * unrepresentable code point is replaced by the charset's own replacement:</p>
 * <ul>
 *   <li>{@link #ASCII}: every code point above U+007F becomes {@code ?}</li>
 *   <li>{@link #UTF_8}: an unpaired surrogate becomes {@code ?}</li>
 *   <li>{@link #UTF_16LE}, {@link #UTF_16BE}, {@link #UTF_32}: an unpaired
 *       surrogate becomes U+FFFD</li>
 * </ul>
 */
public enum TextEncoding
{
    ASCII(StandardCharsets.US_ASCII),
    UTF_8(StandardCharsets.UTF_8),
    UTF_16LE(StandardCharsets.UTF_16LE),
    UTF_16BE(StandardCharsets.UTF_16BE),
    UTF_32(Charset.forName("UTF-32LE"));

    private final Charset charset;

    TextEncoding(Charset charset) {
        this.charset = charset;
    }

    public Charset charset() {
        return charset;
    }

    /**
     * Normalizes {@code text} against this encoding's representable range.
     */
    public String roundTrip(String text) {
        Objects.requireNonNull(text, "text");
        return new String(text.getBytes(charset), charset);
    }
}
