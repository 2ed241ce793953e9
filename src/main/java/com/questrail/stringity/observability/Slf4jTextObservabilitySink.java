package com.questrail.stringity.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TextObservabilitySink that emits logs via SLF4J.
 *
 * <p>The rejected input itself is never logged, only its length.</p>
 */
public final class Slf4jTextObservabilitySink implements TextObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTextObservabilitySink.class);

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {
        log.warn("Stringity decode failure [{}] at {} (input length {}): {}",
            event.codec(),
            event.timestamp(),
            event.inputLength(),
            event.message(),
            event.cause());
    }
}
