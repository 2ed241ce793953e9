package com.questrail.stringity.transform;

import java.util.Objects;

/**
 * Escaping for embedding text in JSON string literals and XML content.
 */
public final class TextEscapes
{
    private TextEscapes() {}

    /**
     * Escapes {@code "} and {@code \}, the short control escapes
     * ({@code \b \f \n \r \t}), and writes every other control character and
     * every non-ASCII code unit as {@code \}{@code uXXXX}.
     */
    public static String toJsonEscaped(String text) {
        Objects.requireNonNull(text, "text");

        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"':
                    out.append("\\\"");
                    break;
                case '\\':
                    out.append("\\\\");
                    break;
                case '\b':
                    out.append("\\b");
                    break;
                case '\f':
                    out.append("\\f");
                    break;
                case '\n':
                    out.append("\\n");
                    break;
                case '\r':
                    out.append("\\r");
                    break;
                case '\t':
                    out.append("\\t");
                    break;
                default:
                    if (c < ' ' || c > 0x7F) {
                        out.append(String.format("\\u%04X", (int) c));
                    } else {
                        out.append(c);
                    }
            }
        }
        return out.toString();
    }

    /** Replaces {@code & " ' < >} with their predefined XML entities. */
    public static String toXmlEscaped(String text) {
        Objects.requireNonNull(text, "text");
        return text.replace("&", "&amp;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
