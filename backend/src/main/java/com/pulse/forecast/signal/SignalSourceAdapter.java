package com.pulse.forecast.signal;

import java.time.Instant;
import java.util.Optional;

/**
 * Contract for an external signal source (news scorer, social scorer, market data, macro feed).
 * Implementations are Spring beans; any number may be registered, including none.
 */
public interface SignalSourceAdapter {

    String name();

    SourceType sourceType();

    /**
     * True when the signal depends on the symbol. Market-wide sources are fetched once per run.
     */
    default boolean symbolScoped() {
        return sourceType() != SourceType.MARKET_CONTEXT;
    }

    /**
     * Fetches the latest signal observed at or before {@code asOf}. Empty when the source has nothing.
     */
    Optional<? extends SourceSignal> fetch(String symbol, Instant asOf);
}
