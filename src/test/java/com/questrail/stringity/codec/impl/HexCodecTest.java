package com.questrail.stringity.codec.impl;

import com.questrail.stringity.codec.TextDecodeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HexCodecTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link HexCodec}: uppercase two-digit encoding of UTF-8 bytes
 * and strict decoding.
 */
final class HexCodecTest
{
    private final HexCodec codec = new HexCodec();

    // ---------------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------------

    @Test
    void asciiEncodesOnePairPerCharacter()
    {
        assertEquals("4869", codec.encode("Hi"));
        assertEquals("7E20", codec.encode("~ "));
    }

    @Test
    void nonAsciiEncodesUtf8Bytes()
    {
        // U+00E9 is C3 A9 in UTF-8
        assertEquals("C3A9", codec.encode("é"));
    }

    @Test
    void emptyEncodesToEmpty()
    {
        assertEquals("", codec.encode(""));
        assertEquals("", codec.decode(""));
    }

    // ---------------------------------------------------------------------
    // Decoding
    // ---------------------------------------------------------------------

    @Test
    void decodeAcceptsEitherCase()
    {
        assertEquals("Jj", codec.decode("4a6A"));
    }

    @Test
    void roundTripPreservesUtf8RepresentableText()
    {
        String text = "héllo wörld 😀 中文";
        assertEquals(text, codec.decode(codec.encode(text)));
    }

    @Test
    void nonHexDigitsAreRejected()
    {
        TextDecodeException e = assertThrows(TextDecodeException.class, () -> codec.decode("zz"));
        assertEquals(HexCodec.NAME, e.codec());
    }

    @Test
    void oddLengthIsRejected()
    {
        assertThrows(TextDecodeException.class, () -> codec.decode("414"));
    }

    @Test
    void malformedUtf8IsRejected()
    {
        // lone lead byte of a two-byte sequence
        assertThrows(TextDecodeException.class, () -> codec.decode("C3"));
    }

    @Test
    void nullIsAProgrammingError()
    {
        assertThrows(NullPointerException.class, () -> codec.decode(null));
        assertThrows(NullPointerException.class, () -> codec.encode(null));
    }
}
