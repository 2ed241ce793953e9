package com.questrail.stringity.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * TextSegmentation
 * -----------------------------------------------------------------------------
 * Delimiter rules for words, frequency tokens, sentences and paragraphs.
 *
 * <p>Splits never report empty segments. A white-space segment after the final
 * sentence terminator is still a segment; only text that is blank as a whole
 * has no sentences.</p>
 */
final class TextSegmentation
{
    /** Runs of space, tab, LF, CR. */
    static final Pattern WORD_DELIMITERS = Pattern.compile("[ \\t\\n\\r]+");

    /** Word delimiters plus {@code . , ! ?}; used for frequency analysis. */
    static final Pattern TOKEN_DELIMITERS = Pattern.compile("[ \\t\\n\\r.,!?]+");

    /** Each terminator is its own delimiter; {@code "?!"} is two of them. */
    static final Pattern SENTENCE_DELIMITERS = Pattern.compile("[.!?]");

    private static final char CR = '\r';
    private static final char LF = '\n';
    private static final int PARAGRAPH_SEPARATOR = 0x2029;

    private TextSegmentation() {}

    static List<String> words(String text)
    {
        return split(text, WORD_DELIMITERS);
    }

    static List<String> tokens(String text)
    {
        return split(text, TOKEN_DELIMITERS);
    }

    static List<String> sentences(String text)
    {
        if (text.isBlank()) {
            return List.of();
        }
        return split(text, SENTENCE_DELIMITERS);
    }

    /**
     * Counts paragraphs with a single forward scan.
     *
     * <p>A paragraph starts at the first non-white-space code point of the text,
     * and at the first non-white-space code point after two or more line
     * breaks. {@code \r\n} is one break. A paragraph separator (U+2029) is a
     * complete paragraph break by itself. White space between breaks does not
     * interrupt the run, so a line holding only spaces still separates
     * paragraphs.</p>
     */
    static int countParagraphs(String text)
    {
        int paragraphs = 0;
        int breaks = 0;
        boolean seenContent = false;

        int i = 0;
        final int len = text.length();
        while (i < len) {
            final int cp = text.codePointAt(i);
            int width = Character.charCount(cp);

            if (cp == CR) {
                breaks++;
                if (i + 1 < len && text.charAt(i + 1) == LF) {
                    width = 2;
                }
            }
            else if (cp == PARAGRAPH_SEPARATOR) {
                breaks += 2;
            }
            else if (isLineBreak(cp)) {
                breaks++;
            }
            else if (!CharacterClasses.isWhitespace(cp)) {
                if (!seenContent || breaks >= 2) {
                    paragraphs++;
                }
                seenContent = true;
                breaks = 0;
            }

            i += width;
        }
        return paragraphs;
    }

    private static boolean isLineBreak(int cp)
    {
        return cp == LF
                || cp == 0x000B     // vertical tab
                || cp == 0x000C     // form feed
                || cp == 0x0085     // next line
                || cp == 0x2028;    // line separator
    }

    private static List<String> split(String text, Pattern delimiters)
    {
        List<String> out = new ArrayList<>();
        for (String segment : delimiters.split(text)) {
            if (segment.isEmpty()) {
                continue;
            }
            out.add(segment);
        }
        return out;
    }
}
