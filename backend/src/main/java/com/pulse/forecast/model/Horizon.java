package com.pulse.forecast.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Forecast horizons, shortest first.
 */
public enum Horizon {
    H1("1h", Duration.ofHours(1)),
    H4("4h", Duration.ofHours(4)),
    D1("1d", Duration.ofDays(1));

    private final String label;
    private final Duration duration;

    Horizon(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    public String label() {
        return label;
    }

    public Duration duration() {
        return duration;
    }

    public Instant after(Instant start) {
        return start.plus(duration);
    }

    public boolean hasElapsed(Instant start, Instant asOf) {
        return !asOf.isBefore(after(start));
    }

    public static Horizon shortest() {
        return H1;
    }

    public static Horizon longest() {
        return D1;
    }
}
