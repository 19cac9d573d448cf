package com.pulse.forecast.signal;

import java.time.Instant;
import java.util.Set;

/**
 * Signals gathered for one symbol at one timestamp. Absent sources are null; sources that timed out
 * or failed are also listed in {@code degradedSources}.
 */
public record SignalBundle(
        String symbol,
        Instant timestamp,
        SentimentSignal sentiment,
        TechnicalSignal technical,
        MarketContextSignal context,
        Set<SourceType> degradedSources
) {

    public SignalBundle {
        degradedSources = degradedSources == null ? Set.of() : Set.copyOf(degradedSources);
    }

    public static SignalBundle of(String symbol, Instant timestamp, SentimentSignal sentiment,
                                  TechnicalSignal technical, MarketContextSignal context) {
        return new SignalBundle(symbol, timestamp, sentiment, technical, context, Set.of());
    }
}
