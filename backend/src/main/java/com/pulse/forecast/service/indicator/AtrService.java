package com.pulse.forecast.service.indicator;

import com.pulse.forecast.config.IndicatorProperties;
import com.pulse.forecast.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class AtrService {

    private final IndicatorProperties indicatorProperties;

    public Optional<AtrResult> calculate(List<Candle> candles) {
        int period = indicatorProperties.getAtrPeriod();
        if (candles == null || candles.size() < period + 1) {
            return Optional.empty();
        }
        double atr = 0.0;
        for (int i = 1; i <= period; i++) {
            atr += trueRange(candles.get(i), candles.get(i - 1));
        }
        atr /= period;
        for (int i = period + 1; i < candles.size(); i++) {
            atr = ((atr * (period - 1)) + trueRange(candles.get(i), candles.get(i - 1))) / period;
        }
        double lastClose = candles.get(candles.size() - 1).getClose();
        double atrPercent = lastClose <= 0 ? 0 : (atr / lastClose) * 100.0;
        return Optional.of(new AtrResult(atr, atrPercent));
    }

    private double trueRange(Candle current, Candle previous) {
        return Math.max(current.getHigh() - current.getLow(),
                Math.max(Math.abs(current.getHigh() - previous.getClose()),
                        Math.abs(current.getLow() - previous.getClose())));
    }

    public record AtrResult(double atr, double atrPercent) {}
}
