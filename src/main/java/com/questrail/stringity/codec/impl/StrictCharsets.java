package com.questrail.stringity.codec.impl;

import com.questrail.stringity.codec.TextDecodeException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;

/**
 * StrictCharsets
 * -----------------------------------------------------------------------------
 * Decodes bytes to text, rejecting malformed or unmappable sequences.
 *
 * <p>{@code new String(bytes, charset)} substitutes U+FFFD for bad input; the
 * decode sides of the codecs must fail instead.</p>
 */
final class StrictCharsets
{
    private StrictCharsets() {}

    static String decode(String codec, byte[] bytes, Charset charset)
    {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        }
        catch (CharacterCodingException e) {
            throw new TextDecodeException(codec,
                    "Decoded bytes are not a valid " + charset.name() + " sequence", e);
        }
    }
}
