package com.questrail.stringity.codec.impl;

import com.questrail.stringity.codec.TextCodec;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * MorseCodec
 * -----------------------------------------------------------------------------
 * International Morse codec over the {@link MorseAlphabet}.
 *
 * <p>Encoding upper-cases the input (locale-independent), silently drops every
 * character outside {@code A-Z0-9} and joins the remaining tokens with single
 * spaces. Decoding splits on single spaces and drops every token the alphabet
 * does not know, including the empty tokens produced by repeated spaces.</p>
 *
 * <p>This codec is lossy and never throws on decode. A round trip reproduces
 * the upper-cased input filtered to the alphabet; word spacing is not
 * preserved.</p>
 */
public final class MorseCodec implements TextCodec
{
    public static final String NAME = "morse";

    static final String SEPARATOR = " ";

    @Override
    public String name()
    {
        return NAME;
    }

    @Override
    public String encode(String text)
    {
        Objects.requireNonNull(text, "text");

        final String upper = text.toUpperCase(Locale.ROOT);
        StringBuilder out = new StringBuilder(upper.length() * 5);

        upper.codePoints().forEach(cp -> {
            Optional<String> token = MorseAlphabet.tokenFor(cp);
            if (token.isPresent()) {
                if (out.length() > 0) {
                    out.append(SEPARATOR);
                }
                out.append(token.get());
            }
        });
        return out.toString();
    }

    @Override
    public String decode(String representation)
    {
        Objects.requireNonNull(representation, "representation");

        StringBuilder out = new StringBuilder();
        for (String token : representation.split(SEPARATOR, -1)) {
            MorseAlphabet.symbolFor(token).ifPresent(out::append);
        }
        return out.toString();
    }
}
