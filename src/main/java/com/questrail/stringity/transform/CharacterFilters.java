package com.questrail.stringity.transform;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Character removal filters. Letters and digits here mean ASCII
 * {@code [a-zA-Z]} and Unicode decimal digits respectively; blank input is
 * returned unchanged.
 */
public final class CharacterFilters
{
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]");
    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");
    private static final Pattern DIGITS = Pattern.compile("\\p{Nd}");
    private static final Pattern LETTERS = Pattern.compile("[a-zA-Z]");
    private static final Pattern SPECIAL = Pattern.compile("[^a-zA-Z0-9\\s]");

    private CharacterFilters() {}

    public static String removeNonAlphanumeric(String text) {
        return remove(text, NON_ALPHANUMERIC);
    }

    public static String removeNonAscii(String text) {
        return remove(text, NON_ASCII);
    }

    public static String removeDigits(String text) {
        return remove(text, DIGITS);
    }

    public static String removeLetters(String text) {
        return remove(text, LETTERS);
    }

    /** Keeps ASCII letters, digits and white space. */
    public static String removeSpecialCharacters(String text) {
        return remove(text, SPECIAL);
    }

    private static String remove(String text, Pattern unwanted) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return text;
        }
        return unwanted.matcher(text).replaceAll("");
    }
}
