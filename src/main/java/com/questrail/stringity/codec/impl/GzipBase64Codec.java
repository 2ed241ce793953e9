package com.questrail.stringity.codec.impl;

import com.questrail.stringity.codec.TextCodec;
import com.questrail.stringity.codec.TextDecodeException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GzipBase64Codec
 * -----------------------------------------------------------------------------
 * Compression codec producing a printable payload.
 *
 * <p>Encoding performs, in order:</p>
 * <ol>
 *   <li>serialization with a two-byte-per-unit charset (UTF-16LE by default)</li>
 *   <li>GZIP compression (DEFLATE)</li>
 *   <li>base64 with the standard alphabet and padding</li>
 * </ol>
 *
 * <p>Decoding reverses each stage and fails if the payload is not base64, if
 * the GZIP stream is corrupt or truncated, or if the decompressed bytes are not
 * a valid sequence in the wide charset (odd length, unpaired surrogate).</p>
 *
 * <p>The empty payload decodes to the empty string.</p>
 */
public final class GzipBase64Codec implements TextCodec
{
    public static final String NAME = "compress";

    private final Charset wideCharset;

    public GzipBase64Codec()
    {
        this(StandardCharsets.UTF_16LE);
    }

    public GzipBase64Codec(Charset wideCharset)
    {
        this.wideCharset = Objects.requireNonNull(wideCharset, "wideCharset");
    }

    @Override
    public String name()
    {
        return NAME;
    }

    @Override
    public String encode(String text)
    {
        Objects.requireNonNull(text, "text");

        final byte[] raw = text.getBytes(wideCharset);
        ByteArrayOutputStream compressed = new ByteArrayOutputStream(Math.max(32, raw.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
            gzip.write(raw);
        }
        catch (IOException e) {
            // ByteArrayOutputStream does not fail; anything here is a JDK defect.
            throw new UncheckedIOException("GZIP compression failed", e);
        }
        return Base64.getEncoder().encodeToString(compressed.toByteArray());
    }

    @Override
    public String decode(String representation)
    {
        Objects.requireNonNull(representation, "representation");
        if (representation.isEmpty()) {
            return representation;
        }

        final byte[] compressed;
        try {
            compressed = Base64.getDecoder().decode(representation);
        }
        catch (IllegalArgumentException e) {
            throw new TextDecodeException(NAME, "Payload is not valid base64", e);
        }

        final byte[] raw;
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            raw = gzip.readAllBytes();
        }
        catch (IOException e) {
            throw new TextDecodeException(NAME, "Payload is not a valid GZIP stream", e);
        }

        return StrictCharsets.decode(NAME, raw, wideCharset);
    }
}
