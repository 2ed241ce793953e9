package com.questrail.stringity.codec.impl;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 digest of the UTF-8 bytes of a text, as 64 lowercase hex digits.
 * One-way; there is no decode side.
 */
public final class Sha256Digest
{
    private static final String ALGORITHM = "SHA-256";

    public String digest(String text)
    {
        Objects.requireNonNull(text, "text");

        final MessageDigest md;
        try {
            md = MessageDigest.getInstance(ALGORITHM);
        }
        catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to provide SHA-256.
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
        return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
    }
}
