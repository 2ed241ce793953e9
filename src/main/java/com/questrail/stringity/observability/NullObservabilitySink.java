package com.questrail.stringity.observability;

/**
 * No-op implementation of TextObservabilitySink.
 */
public final class NullObservabilitySink implements TextObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {}
}
