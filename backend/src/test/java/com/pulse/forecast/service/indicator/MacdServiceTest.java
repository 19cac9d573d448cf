package com.pulse.forecast.service.indicator;

import com.pulse.forecast.config.IndicatorProperties;
import com.pulse.forecast.model.Candle;
import com.pulse.forecast.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MacdServiceTest {

    private final MacdService macdService = new MacdService(new IndicatorProperties());

    @Test
    void uptrendHasPositiveMacdLine() {
        double[] closes = TestCandleFactory.trendingCandles(60, 100, 1.0).stream()
                .mapToDouble(Candle::getClose)
                .toArray();

        MacdService.MacdResult result = macdService.calculate(closes).orElseThrow();
        assertThat(result.macdLine()).isPositive();
        assertThat(result.histogram()).isCloseTo(result.macdLine() - result.signalLine(), within(1e-9));
    }

    @Test
    void needsSlowPlusSignalHistory() {
        assertThat(macdService.calculate(new double[33])).isEmpty();
    }

    @Test
    void emaIsSeededWithSimpleAverage() {
        double[] series = MacdService.ema(new double[]{2, 4, 6, 8}, 3);

        assertThat(series[0]).isNaN();
        assertThat(series[2]).isEqualTo(4.0);
        assertThat(series[3]).isEqualTo(6.0);
    }
}
