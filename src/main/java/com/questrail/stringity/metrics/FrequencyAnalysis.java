package com.questrail.stringity.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * FrequencyAnalysis
 * =============================================================================
 * Most and least frequent characters and words of a text.
 *
 * <h2>Characters</h2>
 * <p>Only code points that are letters or digits take part; everything else
 * (white space, punctuation, symbols) is ignored. Grouping is by exact code
 * point, so {@code 'a'} and {@code 'A'} are different characters.</p>
 *
 * <h2>Words</h2>
 * <p>Words are the non-empty tokens left after splitting on space, tab, LF, CR,
 * {@code .}, {@code ,}, {@code !} and {@code ?}. Grouping is case-sensitive.</p>
 *
 * <h2>Ties and Empty Input</h2>
 * <p>Among items sharing the extreme count, the one that appears first in the
 * text wins (see {@link FrequencyTable}). When nothing qualifies the result is
 * the empty string, not an error.</p>
 */
public final class FrequencyAnalysis
{
    private FrequencyAnalysis() {}

    public static FrequencyTable<String> characterFrequencies(String text) {
        Objects.requireNonNull(text, "text");

        List<String> characters = new ArrayList<>();
        text.codePoints()
                .filter(Character::isLetterOrDigit)
                .forEach(cp -> characters.add(Character.toString(cp)));
        return FrequencyTable.of(characters);
    }

    public static FrequencyTable<String> wordFrequencies(String text) {
        Objects.requireNonNull(text, "text");
        return FrequencyTable.of(TextSegmentation.tokens(text));
    }

    public static String mostFrequentCharacter(String text) {
        return characterFrequencies(text).mostFrequent().orElse("");
    }

    public static String leastFrequentCharacter(String text) {
        return characterFrequencies(text).leastFrequent().orElse("");
    }

    public static String mostFrequentWord(String text) {
        return wordFrequencies(text).mostFrequent().orElse("");
    }

    public static String leastFrequentWord(String text) {
        return wordFrequencies(text).leastFrequent().orElse("");
    }
}
