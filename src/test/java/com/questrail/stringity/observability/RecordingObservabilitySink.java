package com.questrail.stringity.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements TextObservabilitySink {
    private final List<DecodeFailureEvent> events = new ArrayList<>();

    @Override
    public synchronized void onDecodeFailure(DecodeFailureEvent event) {
        events.add(event);
    }

    public synchronized List<DecodeFailureEvent> getDecodeFailures() {
        return new ArrayList<>(events);
    }
}
