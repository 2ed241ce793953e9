package com.questrail.stringity.observability;

/**
 * Receives observability events from the {@code Stringity} facade.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface TextObservabilitySink {
    /**
     * Called when a decode operation rejects its input, before the
     * {@code TextDecodeException} propagates to the caller.
     * @param event the failure details
     */
    void onDecodeFailure(DecodeFailureEvent event);
}
