package com.questrail.stringity.transform;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifier case styles: snake, kebab, camel, pascal and title case.
 *
 * <p>Blank input is returned unchanged. Case mapping uses {@link Locale#ROOT}.</p>
 */
public final class CaseStyles
{
    private static final Pattern LOWER_UPPER_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern WORD_SEPARATORS = Pattern.compile("[\\s_\\-]+");

    private CaseStyles() {}

    /** {@code "helloWorld-foo bar"} becomes {@code "hello_world_foo_bar"}. */
    public static String toSnakeCase(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return text;
        }
        return LOWER_UPPER_BOUNDARY.matcher(text).replaceAll("$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toLowerCase(Locale.ROOT);
    }

    /** {@code "helloWorld_foo bar"} becomes {@code "hello-world-foo-bar"}. */
    public static String toKebabCase(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return text;
        }
        return LOWER_UPPER_BOUNDARY.matcher(text).replaceAll("$1-$2")
                .replace('_', '-')
                .replace(' ', '-')
                .toLowerCase(Locale.ROOT);
    }

    /** {@code "hello big_world"} becomes {@code "helloBigWorld"}. */
    public static String toCamelCase(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return text;
        }
        String[] words = words(text);
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < words.length; i++) {
            out.append(i == 0 ? words[i].toLowerCase(Locale.ROOT) : capitalize(words[i]));
        }
        return out.toString();
    }

    /** {@code "hello big_world"} becomes {@code "HelloBigWorld"}. */
    public static String toPascalCase(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        for (String word : words(text)) {
            out.append(capitalize(word));
        }
        return out.toString();
    }

    /** {@code "hello big_world"} becomes {@code "Hello Big World"}. */
    public static String toTitleCase(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return text;
        }
        String[] words = words(text);
        for (int i = 0; i < words.length; i++) {
            words[i] = capitalize(words[i]);
        }
        return String.join(" ", words);
    }

    private static String[] words(String text) {
        return WORD_SEPARATORS.split(text.strip());
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        int first = word.codePointAt(0);
        int width = Character.charCount(first);
        return new StringBuilder(word.length())
                .appendCodePoint(Character.toUpperCase(first))
                .append(word.substring(width).toLowerCase(Locale.ROOT))
                .toString();
    }
}
