package com.pulse.forecast.signal;

import lombok.Builder;

import java.time.Instant;

/**
 * Market-wide context. Identical for every symbol in a run.
 */
@Builder
public record MarketContextSignal(
        Instant observedAt,
        Double indexChangePct,
        Double vix,
        Boolean marketHours,
        Double sectorPerformance,
        Double marketBreadth
) implements SourceSignal {

    @Override
    public SourceType sourceType() {
        return SourceType.MARKET_CONTEXT;
    }
}
