package com.pulse.forecast.service.outcome;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Port to realized prices. Implementations return the first price observed at or after
 * {@code at}; never one observed earlier.
 */
public interface PriceLookup {

    /**
     * @param horizon how far {@code at} lies past the entry; {@link Duration#ZERO} for the entry itself.
     *                Implementations bound how late an accepted price may be by this span.
     */
    Optional<PriceQuote> priceAt(String symbol, Instant at, Duration horizon);

    record PriceQuote(double price, Instant observedAt) {}
}
