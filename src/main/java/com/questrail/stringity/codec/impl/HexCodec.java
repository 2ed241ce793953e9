package com.questrail.stringity.codec.impl;

import com.questrail.stringity.codec.TextCodec;
import com.questrail.stringity.codec.TextDecodeException;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Objects;

/**
 * HexCodec
 * -----------------------------------------------------------------------------
 * Hexadecimal text codec.
 *
 * <p>Encoding writes the UTF-8 bytes of the text as two uppercase hex digits
 * each, with no separators. For ASCII input this is exactly one digit pair per
 * character ({@code "Hi"} becomes {@code "4869"}).</p>
 *
 * <p>Decoding accepts either digit case, consumes two digits per byte and
 * decodes the bytes as strict UTF-8. It fails on:</p>
 * <ul>
 *   <li>an odd number of characters</li>
 *   <li>any character that is not a hex digit</li>
 *   <li>bytes that are not well-formed UTF-8</li>
 * </ul>
 */
public final class HexCodec implements TextCodec
{
    public static final String NAME = "hex";

    private static final HexFormat UPPER = HexFormat.of().withUpperCase();

    @Override
    public String name()
    {
        return NAME;
    }

    @Override
    public String encode(String text)
    {
        Objects.requireNonNull(text, "text");
        return UPPER.formatHex(text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String decode(String representation)
    {
        Objects.requireNonNull(representation, "representation");

        final int len = representation.length();
        if ((len & 1) != 0) {
            throw new TextDecodeException(NAME,
                    "Hex representation has odd length " + len);
        }

        byte[] bytes = new byte[len / 2];
        for (int r = 0, w = 0; r < len; r += 2, w++) {
            int hi = digit(representation, r);
            int lo = digit(representation, r + 1);
            bytes[w] = (byte) ((hi << 4) | lo);
        }

        return StrictCharsets.decode(NAME, bytes, StandardCharsets.UTF_8);
    }

    private static int digit(String representation, int index)
    {
        final char c = representation.charAt(index);
        if (!HexFormat.isHexDigit(c)) {
            throw new TextDecodeException(NAME, String.format(
                    "Invalid hex digit '%c' at index %d", c, index));
        }
        return HexFormat.fromHexDigit(c);
    }
}
