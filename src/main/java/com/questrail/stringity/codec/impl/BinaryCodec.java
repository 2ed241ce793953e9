package com.questrail.stringity.codec.impl;

import com.questrail.stringity.codec.TextCodec;
import com.questrail.stringity.codec.TextDecodeException;

import java.util.Objects;

/**
 * BinaryCodec
 * -----------------------------------------------------------------------------
 * Space-separated 8-bit binary codec.
 *
 * <p>Encoding writes each UTF-16 code unit as its binary value, left-padded
 * with zeros to eight digits, tokens separated by a single space
 * ({@code "Hi"} becomes {@code "01001000 01101001"}).</p>
 *
 * <p><strong>Narrow by design.</strong> Code units above U+00FF produce tokens
 * longer than eight digits, which {@link #decode(String)} rejects, and bytes
 * above 0x7F decode to {@code ?} under ASCII. Only ASCII input survives a round
 * trip unchanged.</p>
 */
public final class BinaryCodec implements TextCodec
{
    public static final String NAME = "binary";

    static final int TOKEN_WIDTH = 8;
    static final char SEPARATOR = ' ';
    static final char ASCII_REPLACEMENT = '?';

    @Override
    public String name()
    {
        return NAME;
    }

    @Override
    public String encode(String text)
    {
        Objects.requireNonNull(text, "text");

        StringBuilder out = new StringBuilder(text.length() * (TOKEN_WIDTH + 1));
        for (int i = 0; i < text.length(); i++) {
            if (i > 0) {
                out.append(SEPARATOR);
            }
            String bits = Integer.toBinaryString(text.charAt(i));
            for (int pad = bits.length(); pad < TOKEN_WIDTH; pad++) {
                out.append('0');
            }
            out.append(bits);
        }
        return out.toString();
    }

    @Override
    public String decode(String representation)
    {
        Objects.requireNonNull(representation, "representation");
        if (representation.isEmpty()) {
            return representation;
        }

        // -1 keeps trailing empty tokens so "01000001 " is rejected, not trimmed.
        final String[] tokens = representation.split(String.valueOf(SEPARATOR), -1);

        StringBuilder out = new StringBuilder(tokens.length);
        for (int t = 0; t < tokens.length; t++) {
            int value = parseToken(tokens[t], t);
            out.append(value < 0x80 ? (char) value : ASCII_REPLACEMENT);
        }
        return out.toString();
    }

    private static int parseToken(String token, int position)
    {
        if (token.length() != TOKEN_WIDTH) {
            throw new TextDecodeException(NAME, String.format(
                    "Token %d must be exactly %d binary digits: \"%s\"",
                    position, TOKEN_WIDTH, token));
        }

        int value = 0;
        for (int i = 0; i < TOKEN_WIDTH; i++) {
            char c = token.charAt(i);
            if (c != '0' && c != '1') {
                throw new TextDecodeException(NAME, String.format(
                        "Token %d contains non-binary digit '%c': \"%s\"",
                        position, c, token));
            }
            value = (value << 1) | (c - '0');
        }
        return value;
    }
}
