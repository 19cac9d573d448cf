package com.pulse.forecast.signal;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.model.Candle;
import com.pulse.forecast.service.indicator.AtrService;
import com.pulse.forecast.service.indicator.BollingerBandService;
import com.pulse.forecast.service.indicator.MacdService;
import com.pulse.forecast.service.indicator.PriceTrendService;
import com.pulse.forecast.service.indicator.RsiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Derives the technical signal from candle history when a {@link MarketDataProvider} is wired in.
 * Candles stamped after {@code asOf} are ignored. Indicators without enough history stay null.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandleTechnicalSignalAdapter implements SignalSourceAdapter {

    private final ObjectProvider<MarketDataProvider> marketDataProvider;
    private final ForecastProperties forecastProperties;
    private final RsiService rsiService;
    private final MacdService macdService;
    private final BollingerBandService bollingerBandService;
    private final AtrService atrService;
    private final PriceTrendService priceTrendService;

    @Override
    public String name() {
        return "candle-technical";
    }

    @Override
    public SourceType sourceType() {
        return SourceType.TECHNICAL;
    }

    @Override
    public Optional<TechnicalSignal> fetch(String symbol, Instant asOf) {
        MarketDataProvider provider = marketDataProvider.getIfAvailable();
        if (provider == null) {
            return Optional.empty();
        }
        ForecastProperties.Signals signals = forecastProperties.getSignals();
        List<Candle> candles = provider.getCandles(symbol, signals.getCandleTimeframe(), signals.getCandleBars())
                .stream()
                .filter(candle -> candle.getTimestamp() != null && !candle.getTimestamp().isAfter(asOf))
                .toList();
        if (candles.isEmpty()) {
            log.debug("No candles symbol={} asOf={}", symbol, asOf);
            return Optional.empty();
        }
        return Optional.of(toSignal(candles));
    }

    TechnicalSignal toSignal(List<Candle> candles) {
        double[] closes = candles.stream().mapToDouble(Candle::getClose).toArray();
        Candle last = candles.get(candles.size() - 1);
        var macd = macdService.calculate(closes);
        var atr = atrService.calculate(candles);
        return TechnicalSignal.builder()
                .observedAt(last.getTimestamp())
                .currentPrice(last.getClose())
                .rsi(boxed(rsiService.calculate(closes)))
                .macdLine(macd.map(MacdService.MacdResult::macdLine).orElse(null))
                .macdSignal(macd.map(MacdService.MacdResult::signalLine).orElse(null))
                .macdHistogram(macd.map(MacdService.MacdResult::histogram).orElse(null))
                .sma20Ratio(boxed(priceTrendService.smaRatio(closes, 20)))
                .sma50Ratio(boxed(priceTrendService.smaRatio(closes, 50)))
                .sma200Ratio(boxed(priceTrendService.smaRatio(closes, 200)))
                .bollingerWidth(bollingerBandService.calculate(closes)
                        .map(BollingerBandService.BollingerBands::width).orElse(null))
                .atr(atr.map(AtrService.AtrResult::atr).orElse(null))
                .atrPct(atr.map(AtrService.AtrResult::atrPercent).orElse(null))
                .volatility(boxed(priceTrendService.volatility(closes)))
                .volumeRatio(boxed(priceTrendService.volumeRatio(candles)))
                .priceChange1d(boxed(priceTrendService.priceChangePct(closes, 1)))
                .priceChange5d(boxed(priceTrendService.priceChangePct(closes, 5)))
                .dailyRange(boxed(priceTrendService.dailyRangePct(candles)))
                .build();
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
