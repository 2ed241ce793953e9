package com.questrail.stringity;

import com.questrail.stringity.codec.TextCodec;
import com.questrail.stringity.codec.TextDecodeException;
import com.questrail.stringity.codec.TextEncoding;
import com.questrail.stringity.codec.impl.BinaryCodec;
import com.questrail.stringity.codec.impl.GzipBase64Codec;
import com.questrail.stringity.codec.impl.HexCodec;
import com.questrail.stringity.codec.impl.MorseCodec;
import com.questrail.stringity.codec.impl.Rot13Codec;
import com.questrail.stringity.codec.impl.Sha256Digest;
import com.questrail.stringity.config.StringityConfig;
import com.questrail.stringity.internal.time.SystemWallClock;
import com.questrail.stringity.internal.time.WallClock;
import com.questrail.stringity.metrics.FrequencyAnalysis;
import com.questrail.stringity.metrics.TextMetrics;
import com.questrail.stringity.observability.DecodeFailureEvent;
import com.questrail.stringity.observability.NullObservabilitySink;
import com.questrail.stringity.observability.TextObservabilitySink;
import com.questrail.stringity.transform.CaseStyles;
import com.questrail.stringity.transform.CaseTransforms;
import com.questrail.stringity.transform.CharacterFilters;
import com.questrail.stringity.transform.TextEscapes;

import java.util.Objects;
import java.util.Random;

/**
 * Stringity
 * =============================================================================
 * Flat public surface over the codec, metrics and transform packages.
 *
 * <p>Every operation takes one text (decode operations: one encoded
 * representation) and returns one text or one count. Operations are pure; the
 * only state held here is the configuration, the observability sink, and the
 * shuffle generator.</p>
 *
 * <h2>Decode Failures</h2>
 * <p>A rejected decode is reported to the configured
 * {@link TextObservabilitySink} and the same {@link TextDecodeException} is then
 * rethrown. Nothing is retried and no partial result is returned.</p>
 */
public final class Stringity {
    private final StringityConfig config;
    private final TextObservabilitySink observabilitySink;
    private final WallClock wallClock;
    private final Random shuffleRandom;

    private final TextCodec hex = new HexCodec();
    private final TextCodec binary = new BinaryCodec();
    private final TextCodec morse = new MorseCodec();
    private final TextCodec rot13 = new Rot13Codec();
    private final TextCodec compression;
    private final Sha256Digest sha256 = new Sha256Digest();

    private Stringity(
            StringityConfig config,
            TextObservabilitySink observabilitySink,
            WallClock wallClock) {
        this.config = config;
        this.observabilitySink = observabilitySink;
        this.wallClock = wallClock;
        this.compression = new GzipBase64Codec(config.compressionCharset());
        this.shuffleRandom = config.shuffleSeed().isPresent()
                ? new Random(config.shuffleSeed().getAsLong())
                : new Random();
    }

    public static Stringity defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public StringityConfig config() {
        return config;
    }

    // ========================================================================
    // Codecs
    // ========================================================================

    public String toHex(String text) {
        return hex.encode(text);
    }

    public String fromHex(String hexText) {
        return decode(hex, hexText);
    }

    public String toBinary(String text) {
        return binary.encode(text);
    }

    public String fromBinary(String binaryText) {
        return decode(binary, binaryText);
    }

    public String toMorseCode(String text) {
        return morse.encode(text);
    }

    public String fromMorseCode(String morseText) {
        return decode(morse, morseText);
    }

    /** Self-inverse: applying it twice returns the original text. */
    public String toRot13(String text) {
        return rot13.encode(text);
    }

    public String compress(String text) {
        return compression.encode(text);
    }

    public String decompress(String payload) {
        return decode(compression, payload);
    }

    public String toAscii(String text) {
        return TextEncoding.ASCII.roundTrip(text);
    }

    public String toUtf8(String text) {
        return TextEncoding.UTF_8.roundTrip(text);
    }

    /** Little-endian UTF-16. */
    public String toUnicode(String text) {
        return TextEncoding.UTF_16LE.roundTrip(text);
    }

    /** Big-endian UTF-16. */
    public String toUtf16(String text) {
        return TextEncoding.UTF_16BE.roundTrip(text);
    }

    public String toUtf32(String text) {
        return TextEncoding.UTF_32.roundTrip(text);
    }

    public String toSha256(String text) {
        return sha256.digest(text);
    }

    // ========================================================================
    // Metrics
    // ========================================================================

    public int length(String text) {
        return TextMetrics.countCharacters(text);
    }

    public int countCharacters(String text) {
        return TextMetrics.countCharacters(text);
    }

    public int codePointLength(String text) {
        return TextMetrics.codePointLength(text);
    }

    public int logicalLength(String text) {
        return TextMetrics.logicalLength(text);
    }

    public int countWords(String text) {
        return TextMetrics.countWords(text);
    }

    public int countSentences(String text) {
        return TextMetrics.countSentences(text);
    }

    public int countParagraphs(String text) {
        return TextMetrics.countParagraphs(text);
    }

    public int countVowels(String text) {
        return TextMetrics.countVowels(text);
    }

    public int countConsonants(String text) {
        return TextMetrics.countConsonants(text);
    }

    public int countDigits(String text) {
        return TextMetrics.countDigits(text);
    }

    public int countUppercase(String text) {
        return TextMetrics.countUppercase(text);
    }

    public int countLowercase(String text) {
        return TextMetrics.countLowercase(text);
    }

    public int countWhitespace(String text) {
        return TextMetrics.countWhitespace(text);
    }

    public int countPunctuation(String text) {
        return TextMetrics.countPunctuation(text);
    }

    public String mostFrequentCharacter(String text) {
        return FrequencyAnalysis.mostFrequentCharacter(text);
    }

    public String leastFrequentCharacter(String text) {
        return FrequencyAnalysis.leastFrequentCharacter(text);
    }

    public String mostFrequentWord(String text) {
        return FrequencyAnalysis.mostFrequentWord(text);
    }

    public String leastFrequentWord(String text) {
        return FrequencyAnalysis.leastFrequentWord(text);
    }

    // ========================================================================
    // Transforms
    // ========================================================================

    public String toSnakeCase(String text) {
        return CaseStyles.toSnakeCase(text);
    }

    public String toKebabCase(String text) {
        return CaseStyles.toKebabCase(text);
    }

    public String toCamelCase(String text) {
        return CaseStyles.toCamelCase(text);
    }

    public String toPascalCase(String text) {
        return CaseStyles.toPascalCase(text);
    }

    public String toTitleCase(String text) {
        return CaseStyles.toTitleCase(text);
    }

    public String removeNonAlphanumeric(String text) {
        return CharacterFilters.removeNonAlphanumeric(text);
    }

    public String removeNonAscii(String text) {
        return CharacterFilters.removeNonAscii(text);
    }

    public String removeDigits(String text) {
        return CharacterFilters.removeDigits(text);
    }

    public String removeLetters(String text) {
        return CharacterFilters.removeLetters(text);
    }

    public String removeSpecialCharacters(String text) {
        return CharacterFilters.removeSpecialCharacters(text);
    }

    public String toJsonEscaped(String text) {
        return TextEscapes.toJsonEscaped(text);
    }

    public String toXmlEscaped(String text) {
        return TextEscapes.toXmlEscaped(text);
    }

    public String toSarcasm(String text) {
        return CaseTransforms.toSarcasm(text);
    }

    public String swapCase(String text) {
        return CaseTransforms.swapCase(text);
    }

    public String reverse(String text) {
        return CaseTransforms.reverse(text);
    }

    /**
     * Shuffles with this instance's generator, which is seeded from
     * {@link StringityConfig#shuffleSeed()} when one is configured.
     */
    public String shuffle(String text) {
        synchronized (shuffleRandom) {
            return CaseTransforms.shuffle(text, shuffleRandom);
        }
    }

    public String shuffle(String text, Random random) {
        return CaseTransforms.shuffle(text, random);
    }

    private String decode(TextCodec codec, String representation) {
        Objects.requireNonNull(representation, "representation");
        try {
            return codec.decode(representation);
        } catch (TextDecodeException e) {
            observabilitySink.onDecodeFailure(new DecodeFailureEvent(
                    wallClock.now(),
                    e.codec(),
                    representation.length(),
                    e.getMessage(),
                    e));
            throw e;
        }
    }

    public static final class Builder {
        private StringityConfig config = StringityConfig.defaults();
        private TextObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(StringityConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(TextObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Stringity build() {
            return new Stringity(
                    Objects.requireNonNull(config, "config"),
                    Objects.requireNonNull(observabilitySink, "observabilitySink"),
                    Objects.requireNonNull(wallClock, "wallClock"));
        }
    }
}
