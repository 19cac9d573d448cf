package com.pulse.forecast.service.outcome;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.service.feature.MarketCalendar;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Latest observation time a {@link PriceLookup} may accept for a target instant. The window opens at
 * the next trading session and scales with the horizon.
 */
@Component
@RequiredArgsConstructor
public class PriceTolerance {

    private final MarketCalendar marketCalendar;
    private final ForecastProperties forecastProperties;

    public Instant latestAcceptable(Instant at, Duration horizon) {
        ForecastProperties.PriceLookup settings = forecastProperties.getPriceLookup();
        long minutes = Math.max(settings.getMinToleranceMinutes(),
                Math.round(horizon.toMinutes() * settings.getToleranceFraction()));
        return marketCalendar.nextSessionStart(at).plus(Duration.ofMinutes(minutes));
    }
}
