package com.pulse.forecast.service.outcome;

import com.pulse.forecast.repository.FeatureRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fallback lookup that reads {@code current_price} from the next stored feature row of the symbol.
 * Consulted after every other registered {@link PriceLookup}. Feature rows are daily, so the
 * horizon-scaled tolerance leaves hourly exits to intraday sources.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
public class FeatureStorePriceLookup implements PriceLookup {

    private final FeatureRecordRepository featureRecordRepository;
    private final PriceTolerance priceTolerance;

    @Override
    public Optional<PriceQuote> priceAt(String symbol, Instant at, Duration horizon) {
        Instant latest = priceTolerance.latestAcceptable(at, horizon);
        return featureRecordRepository
                .findFirstBySymbolAndTimestampGreaterThanEqualAndCurrentPriceIsNotNullOrderByTimestampAsc(symbol, at)
                .filter(record -> !record.getTimestamp().isAfter(latest))
                .map(record -> new PriceQuote(record.getCurrentPrice(), record.getTimestamp()));
    }
}
