package com.questrail.stringity.codec.impl;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

final class MorseCodecTest
{
    private final MorseCodec codec = new MorseCodec();

    @Test
    void alphabetCoversLettersAndDigits()
    {
        assertEquals(36, MorseAlphabet.size());
        for (char c = 'A'; c <= 'Z'; c++) {
            String token = MorseAlphabet.tokenFor(c).orElseThrow();
            assertEquals(c, MorseAlphabet.symbolFor(token).orElseThrow());
        }
        for (char c = '0'; c <= '9'; c++) {
            String token = MorseAlphabet.tokenFor(c).orElseThrow();
            assertEquals(c, MorseAlphabet.symbolFor(token).orElseThrow());
        }
    }

    @Test
    void encodeUpperCasesAndJoinsWithSingleSpaces()
    {
        assertEquals("... --- ...", codec.encode("SOS"));
        assertEquals("... --- ...", codec.encode("sos"));
    }

    @Test
    void encodeDropsCharactersOutsideTheAlphabet()
    {
        assertEquals(".... .. .....", codec.encode("Hi, 5!"));
        assertEquals("", codec.encode("?! 😀"));
    }

    @Test
    void decodeDropsUnknownAndEmptyTokens()
    {
        assertEquals("SOS", codec.decode("... --- ...  ........"));
        assertEquals("", codec.decode(""));
    }

    @Test
    void roundTripKeepsOnlyAlphabetCharacters()
    {
        String text = "Hello World 2024";
        String upper = text.toUpperCase(Locale.ROOT);
        String expected = upper.replaceAll("[^A-Z0-9]", "");

        assertEquals(expected, codec.decode(codec.encode(upper)));
        assertEquals("HELLOWORLD2024", expected);
    }
}
