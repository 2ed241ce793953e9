package com.questrail.stringity.transform;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextEscapesTest
{
    @Test
    void jsonEscapesQuotesBackslashesAndControls() {
        assertEquals("say \\\"hi\\\"\\n", TextEscapes.toJsonEscaped("say \"hi\"\n"));
        assertEquals("a\\\\b\\t\\r\\b\\f", TextEscapes.toJsonEscaped("a\\b\t\r\b\f"));
    }

    @Test
    void jsonEscapesNonAsciiAndOtherControlsAsUnicode() {
        assertEquals("caf\\u00E9", TextEscapes.toJsonEscaped("café"));
        assertEquals("\\u0001", TextEscapes.toJsonEscaped("\u0001"));
    }

    @Test
    void xmlEscapesPredefinedEntities() {
        assertEquals("&lt;a href=&apos;x&apos;&gt;&amp;&quot;&lt;/a&gt;",
                TextEscapes.toXmlEscaped("<a href='x'>&\"</a>"));
    }
}
