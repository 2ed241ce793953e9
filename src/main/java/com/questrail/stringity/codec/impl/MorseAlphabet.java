package com.questrail.stringity.codec.impl;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * MorseAlphabet
 * -----------------------------------------------------------------------------
 * Immutable bidirectional mapping between the 36 symbols {@code A-Z}, {@code 0-9}
 * and their International Morse tokens.
 *
 * <p>Only the symbol-to-token direction is authored. The token-to-symbol map is
 * derived from it once, during class initialization, so the two directions
 * cannot disagree. A duplicated token fails class initialization.</p>
 */
final class MorseAlphabet
{
    private static final Map<Character, String> TOKEN_BY_SYMBOL;
    private static final Map<String, Character> SYMBOL_BY_TOKEN;

    static {
        Map<Character, String> tokens = new LinkedHashMap<>(64);
        tokens.put('A', ".-");
        tokens.put('B', "-...");
        tokens.put('C', "-.-.");
        tokens.put('D', "-..");
        tokens.put('E', ".");
        tokens.put('F', "..-.");
        tokens.put('G', "--.");
        tokens.put('H', "....");
        tokens.put('I', "..");
        tokens.put('J', ".---");
        tokens.put('K', "-.-");
        tokens.put('L', ".-..");
        tokens.put('M', "--");
        tokens.put('N', "-.");
        tokens.put('O', "---");
        tokens.put('P', ".--.");
        tokens.put('Q', "--.-");
        tokens.put('R', ".-.");
        tokens.put('S', "...");
        tokens.put('T', "-");
        tokens.put('U', "..-");
        tokens.put('V', "...-");
        tokens.put('W', ".--");
        tokens.put('X', "-..-");
        tokens.put('Y', "-.--");
        tokens.put('Z', "--..");
        tokens.put('1', ".----");
        tokens.put('2', "..---");
        tokens.put('3', "...--");
        tokens.put('4', "....-");
        tokens.put('5', ".....");
        tokens.put('6', "-....");
        tokens.put('7', "--...");
        tokens.put('8', "---..");
        tokens.put('9', "----.");
        tokens.put('0', "-----");

        Map<String, Character> symbols = new HashMap<>(tokens.size() * 2);
        for (Map.Entry<Character, String> e : tokens.entrySet()) {
            Character prev = symbols.put(e.getValue(), e.getKey());
            if (prev != null) {
                throw new IllegalStateException(String.format(
                        "Morse token %s assigned to both %c and %c",
                        e.getValue(), prev, e.getKey()));
            }
        }

        TOKEN_BY_SYMBOL = Collections.unmodifiableMap(tokens);
        SYMBOL_BY_TOKEN = Collections.unmodifiableMap(symbols);
    }

    private MorseAlphabet() {}

    /**
     * Returns the token for an upper-case symbol, or empty if the symbol is not
     * part of the alphabet.
     */
    static Optional<String> tokenFor(int symbol)
    {
        if (symbol > Character.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.ofNullable(TOKEN_BY_SYMBOL.get((char) symbol));
    }

    static Optional<Character> symbolFor(String token)
    {
        return Optional.ofNullable(SYMBOL_BY_TOKEN.get(token));
    }

    static int size()
    {
        return TOKEN_BY_SYMBOL.size();
    }
}
