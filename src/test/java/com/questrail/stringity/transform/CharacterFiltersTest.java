package com.questrail.stringity.transform;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CharacterFiltersTest
{
    @Test
    void removals() {
        assertEquals("abc1", CharacterFilters.removeNonAlphanumeric("a-b c!1"));
        assertEquals("hllo", CharacterFilters.removeNonAscii("héllo"));
        assertEquals("ab", CharacterFilters.removeDigits("a1b2"));
        assertEquals("12", CharacterFilters.removeLetters("a1b2"));
        assertEquals("Hi you", CharacterFilters.removeSpecialCharacters("Hi, you!"));
    }

    @Test
    void blankInputIsReturnedUnchanged() {
        assertEquals("   ", CharacterFilters.removeLetters("   "));
        assertEquals("", CharacterFilters.removeDigits(""));
    }
}
