package com.questrail.stringity.metrics;

/**
 * CharacterClasses
 * -----------------------------------------------------------------------------
 * Code point predicates shared by the counting and frequency operations.
 *
 * <p>All predicates follow the Unicode Character Database as exposed by
 * {@link Character}, with two deliberate widenings:</p>
 * <ul>
 *   <li>white space also covers the no-break spaces (general category Zs) and
 *       NEXT LINE (U+0085), which {@link Character#isWhitespace(int)} excludes</li>
 *   <li>punctuation is the union of the seven {@code P*} general categories</li>
 * </ul>
 */
final class CharacterClasses
{
    static final String VOWELS = "aeiouAEIOU";

    private static final int NEXT_LINE = 0x0085;

    private CharacterClasses() {}

    static boolean isVowel(int cp)
    {
        return cp < Character.MIN_SUPPLEMENTARY_CODE_POINT && VOWELS.indexOf(cp) >= 0;
    }

    static boolean isConsonant(int cp)
    {
        return Character.isLetter(cp) && !isVowel(cp);
    }

    static boolean isWhitespace(int cp)
    {
        return Character.isWhitespace(cp) || Character.isSpaceChar(cp) || cp == NEXT_LINE;
    }

    static boolean isPunctuation(int cp)
    {
        switch (Character.getType(cp)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
                return true;
            default:
                return false;
        }
    }
}
