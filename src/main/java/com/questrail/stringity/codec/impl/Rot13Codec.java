package com.questrail.stringity.codec.impl;

import com.questrail.stringity.codec.TextCodec;

import java.util.Objects;

/**
 * Rot13Codec
 * -----------------------------------------------------------------------------
 * Caesar shift of 13 over {@code [a-zA-Z]}; every other character passes
 * through unchanged. The shift is its own inverse, so {@link #decode(String)}
 * is the same operation as {@link #encode(String)} and never fails.
 */
public final class Rot13Codec implements TextCodec
{
    public static final String NAME = "rot13";

    private static final int SHIFT = 13;
    private static final int LETTERS = 26;

    @Override
    public String name()
    {
        return NAME;
    }

    @Override
    public String encode(String text)
    {
        Objects.requireNonNull(text, "text");

        char[] out = text.toCharArray();
        for (int i = 0; i < out.length; i++) {
            out[i] = rotate(out[i]);
        }
        return new String(out);
    }

    @Override
    public String decode(String representation)
    {
        return encode(representation);
    }

    private static char rotate(char c)
    {
        if (c >= 'a' && c <= 'z') {
            return (char) ('a' + (c - 'a' + SHIFT) % LETTERS);
        }
        if (c >= 'A' && c <= 'Z') {
            return (char) ('A' + (c - 'A' + SHIFT) % LETTERS);
        }
        return c;
    }
}
