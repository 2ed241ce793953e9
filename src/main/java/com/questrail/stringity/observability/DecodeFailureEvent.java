package com.questrail.stringity.observability;

import java.time.Instant;

/**
 * Record describing a rejected decode.
 *
 * @param codec name of the codec that rejected the input
 * @param inputLength length of the rejected representation, in UTF-16 code units
 */
public record DecodeFailureEvent(
    Instant timestamp,
    String codec,
    int inputLength,
    String message,
    Throwable cause
) {
}
