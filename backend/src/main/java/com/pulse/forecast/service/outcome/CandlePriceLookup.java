package com.pulse.forecast.service.outcome;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.model.Candle;
import com.pulse.forecast.signal.MarketDataProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * Intraday lookup over the {@link MarketDataProvider} feed: the open of the first candle stamped at
 * or after the target. Empty when no provider is wired in.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class CandlePriceLookup implements PriceLookup {

    private final ObjectProvider<MarketDataProvider> marketDataProvider;
    private final ForecastProperties forecastProperties;
    private final PriceTolerance priceTolerance;

    @Override
    public Optional<PriceQuote> priceAt(String symbol, Instant at, Duration horizon) {
        MarketDataProvider provider = marketDataProvider.getIfAvailable();
        if (provider == null) {
            return Optional.empty();
        }
        ForecastProperties.PriceLookup settings = forecastProperties.getPriceLookup();
        Instant latest = priceTolerance.latestAcceptable(at, horizon);
        Optional<PriceQuote> quote = provider.getCandles(symbol, settings.getIntradayTimeframe(), settings.getIntradayBars())
                .stream()
                .filter(candle -> candle.getTimestamp() != null && !candle.getTimestamp().isBefore(at))
                .min(Comparator.comparing(Candle::getTimestamp))
                .filter(candle -> !candle.getTimestamp().isAfter(latest))
                .map(candle -> new PriceQuote(candle.getOpen(), candle.getTimestamp()));
        if (quote.isEmpty()) {
            log.debug("No intraday candle symbol={} at={} latest={}", symbol, at, latest);
        }
        return quote;
    }
}
