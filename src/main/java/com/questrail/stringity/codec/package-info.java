/**
 * Stringity Codecs
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong>: paired
 * encode/decode transformations between a text and another text
 * representation of it.</p>
 *
 * <ul>
 *   <li>{@link com.questrail.stringity.codec.TextCodec}: the encode/decode contract</li>
 *   <li>{@link com.questrail.stringity.codec.TextDecodeException}: the single
 *       malformed-input failure raised by every decode side</li>
 *   <li>{@link com.questrail.stringity.codec.TextEncoding}: identity re-encodings
 *       through a fixed set of byte encodings</li>
 * </ul>
 *
 * <h2>Round-Trip Contract</h2>
 * <p>For every codec, {@code decode(encode(x)) == x} holds on the codec's
 * representable domain:</p>
 *
 * <pre>
 *   hex, rot13, compress     all strings (hex: well-formed UTF-16 only)
 *   binary                   ASCII only
 *   morse                    [A-Z0-9] tokens, single-space separated
 * </pre>
 *
 * <p>Outside that domain the encode side loses information silently (binary
 * above U+00FF, Morse characters outside the alphabet). The decode side never
 * repairs its input: malformed representations fail with
 * {@link com.questrail.stringity.codec.TextDecodeException}.</p>
 *
 * <p>Implementations live in {@code com.questrail.stringity.codec.impl}.</p>
 */
package com.questrail.stringity.codec;
