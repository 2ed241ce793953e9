package com.questrail.stringity.metrics;

import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TextMetrics
 * =============================================================================
 * Counting operations over a complete text.
 *
 * <p>Classification counts scan code points, so a supplementary character
 * (one surrogate pair) counts once. Every operation returns {@code 0} for the
 * empty string.</p>
 *
 * <h2>Three Notions of Length</h2>
 * <ul>
 *   <li>{@link #countCharacters(String)}: UTF-16 code units, i.e.
 *       {@link String#length()}</li>
 *   <li>{@link #codePointLength(String)}: Unicode code points</li>
 *   <li>{@link #logicalLength(String)}: extended grapheme clusters, the
 *       user-perceived characters. {@code e} followed by U+0301 is two code points but one
 *       grapheme.</li>
 * </ul>
 *
 * <p>{@link #logicalLength(String)} expects NFC input. Other input is counted
 * as-is and never fails.</p>
 */
public final class TextMetrics
{
    private static final Pattern GRAPHEME_CLUSTER = Pattern.compile("\\X");

    private TextMetrics() {}

    public static int countCharacters(String text) {
        Objects.requireNonNull(text, "text");
        return text.length();
    }

    public static int codePointLength(String text) {
        Objects.requireNonNull(text, "text");
        return text.codePointCount(0, text.length());
    }

    public static int logicalLength(String text) {
        Objects.requireNonNull(text, "text");

        Matcher m = GRAPHEME_CLUSTER.matcher(text);
        int clusters = 0;
        while (m.find()) {
            clusters++;
        }
        return clusters;
    }

    public static int countWords(String text) {
        Objects.requireNonNull(text, "text");
        return TextSegmentation.words(text).size();
    }

    /**
     * Counts non-empty segments between {@code .}, {@code !} and {@code ?}.
     * Adjacent terminators are not collapsed, and trailing white space after the
     * last terminator is a segment of its own. Blank text has no sentences.
     */
    public static int countSentences(String text) {
        Objects.requireNonNull(text, "text");
        return TextSegmentation.sentences(text).size();
    }

    public static int countParagraphs(String text) {
        Objects.requireNonNull(text, "text");
        return TextSegmentation.countParagraphs(text);
    }

    public static int countVowels(String text) {
        return count(text, CharacterClasses::isVowel);
    }

    public static int countConsonants(String text) {
        return count(text, CharacterClasses::isConsonant);
    }

    public static int countDigits(String text) {
        return count(text, Character::isDigit);
    }

    public static int countUppercase(String text) {
        return count(text, Character::isUpperCase);
    }

    public static int countLowercase(String text) {
        return count(text, Character::isLowerCase);
    }

    public static int countWhitespace(String text) {
        return count(text, CharacterClasses::isWhitespace);
    }

    public static int countPunctuation(String text) {
        return count(text, CharacterClasses::isPunctuation);
    }

    private static int count(String text, IntPredicate predicate) {
        Objects.requireNonNull(text, "text");
        return (int) text.codePoints().filter(predicate).count();
    }
}
