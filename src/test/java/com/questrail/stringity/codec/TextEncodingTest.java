package com.questrail.stringity.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TextEncodingTest
{
    @Test
    void unicodeEncodingsAreIdentityOnWellFormedText()
    {
        String text = "héllo wörld 😀 中文";
        assertEquals(text, TextEncoding.UTF_8.roundTrip(text));
        assertEquals(text, TextEncoding.UTF_16LE.roundTrip(text));
        assertEquals(text, TextEncoding.UTF_16BE.roundTrip(text));
        assertEquals(text, TextEncoding.UTF_32.roundTrip(text));
    }

    @Test
    void asciiIsIdentityOnAscii()
    {
        assertEquals("plain ASCII ~!", TextEncoding.ASCII.roundTrip("plain ASCII ~!"));
    }

    @Test
    void asciiReplacesCodePointsAboveSevenBits()
    {
        assertEquals("h?llo", TextEncoding.ASCII.roundTrip("héllo"));
    }

    @Test
    void utf8ReplacesUnpairedSurrogatesWithQuestionMark()
    {
        assertEquals("a?b", TextEncoding.UTF_8.roundTrip("a\uD800b"));
        assertEquals("?x", TextEncoding.UTF_8.roundTrip("\uDC00x"));
    }

    @Test
    void asciiReplacesUnpairedSurrogatesWithQuestionMark()
    {
        assertEquals("a?b", TextEncoding.ASCII.roundTrip("a\uD800b"));
    }

    @Test
    void wideEncodingsReplaceUnpairedSurrogatesWithReplacementCharacter()
    {
        assertEquals("a\uFFFDb", TextEncoding.UTF_16LE.roundTrip("a\uD800b"));
        assertEquals("a\uFFFDb", TextEncoding.UTF_16BE.roundTrip("a\uD800b"));
        assertEquals("a\uFFFDb", TextEncoding.UTF_32.roundTrip("a\uD800b"));
    }

    @Test
    void emptyIsEmpty()
    {
        for (TextEncoding encoding : TextEncoding.values()) {
            assertEquals("", encoding.roundTrip(""), encoding.name());
        }
    }
}
