package com.questrail.stringity.codec;

/**
 * TextCodec
 * -----------------------------------------------------------------------------
 * A paired encode/decode transformation between two text representations.
 *
 * <p>Implementations are stateless and thread-safe. Each call consumes a
 * complete in-memory string and returns a complete result; streaming or
 * accumulation across calls is not supported.</p>
 *
 * <p>The encode side is total: every string has an encoded form, although some
 * codecs drop characters they cannot represent (documented per codec). The
 * decode side is partial: a representation that the encode side could not have
 * produced is rejected with a {@link TextDecodeException}.</p>
 *
 * <p>{@code null} arguments are programming errors and are rejected with
 * {@link NullPointerException}, never with {@link TextDecodeException}.</p>
 */
public interface TextCodec
{
    /**
     * Short, stable name used in diagnostics (e.g. {@code "hex"}).
     */
    String name();

    /**
     * Encodes {@code text} into this codec's representation.
     *
     * @param text the text to encode
     * @return the canonical encoded representation
     */
    String encode(String text);

    /**
     * Decodes a representation previously produced by {@link #encode(String)}.
     *
     * @param representation the encoded form
     * @return the decoded text
     * @throws TextDecodeException if {@code representation} is malformed for this codec
     */
    String decode(String representation);
}
