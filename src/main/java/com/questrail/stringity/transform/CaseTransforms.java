package com.questrail.stringity.transform;

import java.util.Objects;
import java.util.Random;

/**
 * Character-order and character-case transforms: sarcasm case, swap case,
 * reverse and shuffle.
 */
public final class CaseTransforms
{
    private CaseTransforms() {}

    /** Lower-cases even indices and upper-cases odd ones: {@code "hello"} becomes {@code "hElLo"}. */
    public static String toSarcasm(String text) {
        Objects.requireNonNull(text, "text");

        char[] out = text.toCharArray();
        for (int i = 0; i < out.length; i++) {
            out[i] = (i % 2 == 0) ? Character.toLowerCase(out[i]) : Character.toUpperCase(out[i]);
        }
        return new String(out);
    }

    public static String swapCase(String text) {
        Objects.requireNonNull(text, "text");

        char[] out = text.toCharArray();
        for (int i = 0; i < out.length; i++) {
            char c = out[i];
            if (Character.isUpperCase(c)) {
                out[i] = Character.toLowerCase(c);
            } else if (Character.isLowerCase(c)) {
                out[i] = Character.toUpperCase(c);
            }
        }
        return new String(out);
    }

    /** Reverses code points; surrogate pairs stay in order. */
    public static String reverse(String text) {
        Objects.requireNonNull(text, "text");
        return new StringBuilder(text).reverse().toString();
    }

    /**
     * Fisher-Yates shuffle of the code units of {@code text}.
     *
     * <p>The generator is supplied by the caller; two calls with generators in
     * the same state produce the same permutation.</p>
     */
    public static String shuffle(String text, Random random) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(random, "random");

        char[] out = text.toCharArray();
        for (int i = out.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            char tmp = out[i];
            out[i] = out[j];
            out[j] = tmp;
        }
        return new String(out);
    }
}
