package com.pulse.forecast.signal;

import java.time.Instant;

/**
 * Output of one signal source. Each source has its own record type.
 */
public interface SourceSignal {

    SourceType sourceType();

    /**
     * When the source observed the values. Must not be later than the feature timestamp.
     */
    Instant observedAt();
}
