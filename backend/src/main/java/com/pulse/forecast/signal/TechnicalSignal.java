package com.pulse.forecast.signal;

import lombok.Builder;

import java.time.Instant;
import java.util.stream.Stream;

@Builder
public record TechnicalSignal(
        Instant observedAt,
        Double rsi,
        Double macdLine,
        Double macdSignal,
        Double macdHistogram,
        Double sma20Ratio,
        Double sma50Ratio,
        Double sma200Ratio,
        Double bollingerWidth,
        Double atr,
        Double atrPct,
        Double volatility,
        Double volumeRatio,
        Double currentPrice,
        Double priceChange1d,
        Double priceChange5d,
        Double dailyRange
) implements SourceSignal {

    @Override
    public SourceType sourceType() {
        return SourceType.TECHNICAL;
    }

    public boolean hasAnyFiniteValue() {
        return Stream.of(rsi, macdLine, macdSignal, macdHistogram, sma20Ratio, sma50Ratio, sma200Ratio,
                        bollingerWidth, atr, atrPct, volatility, volumeRatio, currentPrice, priceChange1d,
                        priceChange5d, dailyRange)
                .anyMatch(value -> value != null && Double.isFinite(value));
    }
}
