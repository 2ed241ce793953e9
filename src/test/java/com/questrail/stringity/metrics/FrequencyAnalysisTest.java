package com.questrail.stringity.metrics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyAnalysisTest
{
    @Test
    void mostFrequentCharacterTieGoesToFirstSeen() {
        assertEquals("a", FrequencyAnalysis.mostFrequentCharacter("aabb"));
        assertEquals("b", FrequencyAnalysis.mostFrequentCharacter("bbaa"));
    }

    @Test
    void leastFrequentCharacter() {
        assertEquals("c", FrequencyAnalysis.leastFrequentCharacter("aabbc"));
        assertEquals("a", FrequencyAnalysis.leastFrequentCharacter("abab"));
    }

    @Test
    void onlyLettersAndDigitsQualify() {
        assertEquals("1", FrequencyAnalysis.mostFrequentCharacter("a1 1!!!!"));
        assertEquals("", FrequencyAnalysis.mostFrequentCharacter("!!! ???"));
        assertEquals("", FrequencyAnalysis.leastFrequentCharacter(""));
    }

    @Test
    void charactersAreCaseSensitiveCodePoints() {
        assertEquals("A", FrequencyAnalysis.mostFrequentCharacter("aAA"));
        // MATHEMATICAL BOLD CAPITAL A twice, then 'b'
        assertEquals("\uD835\uDC00", FrequencyAnalysis.mostFrequentCharacter("\uD835\uDC00\uD835\uDC00b"));
    }

    @Test
    void mostAndLeastFrequentWord() {
        assertEquals("the", FrequencyAnalysis.mostFrequentWord("the cat and the hat"));
        assertEquals("cat", FrequencyAnalysis.leastFrequentWord("the cat and the hat"));
    }

    @Test
    void wordTiesGoToFirstSeen() {
        assertEquals("a", FrequencyAnalysis.mostFrequentWord("a b. b, a! c"));
        assertEquals("c", FrequencyAnalysis.leastFrequentWord("a b. b, a! c"));
        assertEquals("Go", FrequencyAnalysis.mostFrequentWord("Go, go. GO!"));
        assertEquals("Go", FrequencyAnalysis.leastFrequentWord("Go, go. GO!"));
    }

    @Test
    void emptyInputYieldsEmptyWord() {
        assertEquals("", FrequencyAnalysis.mostFrequentWord(""));
        assertEquals("", FrequencyAnalysis.leastFrequentWord(" \t\r\n.,!?"));
    }

    @Test
    void frequencyTablesAreExposed() {
        FrequencyTable<String> words = FrequencyAnalysis.wordFrequencies("to be or not to be");
        assertEquals(2, words.count("to"));
        assertEquals(2, words.count("be"));
        assertEquals(1, words.count("or"));

        FrequencyTable<String> chars = FrequencyAnalysis.characterFrequencies("a-a");
        assertEquals(1, chars.size());
        assertEquals(2, chars.count("a"));
    }
}
