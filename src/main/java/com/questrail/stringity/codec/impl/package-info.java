/**
 * Concrete {@link com.questrail.stringity.codec.TextCodec} implementations.
 *
 * <p>Package-private helpers hold the shared mechanics: the Morse tables
 * ({@code MorseAlphabet}) and strict byte-to-text decoding
 * ({@code StrictCharsets}). Public classes are stateless and may be shared
 * freely across threads.</p>
 */
package com.questrail.stringity.codec.impl;
