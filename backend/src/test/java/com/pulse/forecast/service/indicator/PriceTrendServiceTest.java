package com.pulse.forecast.service.indicator;

import com.pulse.forecast.config.IndicatorProperties;
import com.pulse.forecast.model.Candle;
import com.pulse.forecast.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PriceTrendServiceTest {

    private final PriceTrendService service = new PriceTrendService(new IndicatorProperties());

    @Test
    void priceChangeIsPercentOfEarlierClose() {
        assertThat(service.priceChangePct(new double[]{100.0, 102.0, 105.0}, 2).getAsDouble())
                .isCloseTo(5.0, within(1e-9));
        assertThat(service.priceChangePct(new double[]{100.0}, 1)).isEmpty();
    }

    @Test
    void smaRatioAboveOneInUptrend() {
        double[] closes = TestCandleFactory.trendingCandles(60, 100, 1.0).stream()
                .mapToDouble(Candle::getClose)
                .toArray();

        assertThat(service.smaRatio(closes, 20).getAsDouble()).isGreaterThan(1.0);
        assertThat(service.smaRatio(closes, 200)).isEmpty();
    }

    @Test
    void volumeRatioComparesLastBarWithAverage() {
        List<Candle> candles = TestCandleFactory.trendingCandles(21, 100, 1.0);
        candles.get(20).setVolume(2 * candles.get(10).getVolume());

        double expectedAverage = candles.subList(0, 20).stream().mapToLong(Candle::getVolume).average().orElseThrow();
        assertThat(service.volumeRatio(candles).getAsDouble())
                .isCloseTo(candles.get(20).getVolume() / expectedAverage, within(1e-9));
    }

    @Test
    void volatilityIsZeroForConstantReturns() {
        double[] closes = new double[30];
        closes[0] = 100.0;
        for (int i = 1; i < closes.length; i++) {
            closes[i] = closes[i - 1] * 1.01;
        }

        assertThat(service.volatility(closes).getAsDouble()).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void dailyRangeUsesLastBar() {
        List<Candle> candles = TestCandleFactory.oscillatingCandles(5, 100, 2.0);
        Candle last = candles.get(4);

        assertThat(service.dailyRangePct(candles).getAsDouble())
                .isCloseTo((last.getHigh() - last.getLow()) / last.getClose() * 100.0, within(1e-9));
    }
}
