package com.pulse.forecast.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@RequiredArgsConstructor
public class SignalSourceResilienceConfig {

    private final ForecastProperties forecastProperties;

    /**
     * One breaker per signal source, created on demand under the source name.
     */
    @Bean
    public CircuitBreakerRegistry signalCircuitBreakerRegistry() {
        ForecastProperties.Signals signals = forecastProperties.getSignals();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(signals.getCircuitFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(signals.getCircuitWaitOpenSeconds()))
                .slidingWindowSize(signals.getCircuitSlidingWindowSize())
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public TimeLimiter signalTimeLimiter() {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(forecastProperties.getSignals().getTimeoutMs()))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("signal-sources", config);
    }
}
