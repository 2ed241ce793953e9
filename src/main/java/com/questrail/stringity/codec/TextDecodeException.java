package com.questrail.stringity.codec;

import java.util.Objects;

/**
 * Indicates that an encoded representation could not be decoded back into
 * text.
 *
 * This typically reflects:
 * <ul>
 *   <li>Characters outside the codec's alphabet (e.g. non-hex digits)</li>
 *   <li>An illegal representation shape (odd hex length, short binary token)</li>
 *   <li>Invalid base64 or a corrupt compressed stream</li>
 *   <li>Bytes that are not a well-formed sequence in the target charset</li>
 * </ul>
 *
 * A decode never returns a partial result; it either succeeds or throws.
 */
public final class TextDecodeException extends RuntimeException
{
    private final String codec;

    public TextDecodeException(String codec, String message) {
        super(message);
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public TextDecodeException(String codec, String message, Throwable cause) {
        super(message, cause);
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Name of the codec that rejected the input.
     */
    public String codec() {
        return codec;
    }
}
