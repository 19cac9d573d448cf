package com.pulse.forecast.signal;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Opens a fresh {@link SignalSourceClient} for each phase run.
 */
@Component
public class SignalSourceClientFactory {

    private final ObjectProvider<SignalSourceAdapter> adapters;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiter timeLimiter;
    private final Executor fetchExecutor;

    public SignalSourceClientFactory(ObjectProvider<SignalSourceAdapter> adapters,
                                     CircuitBreakerRegistry circuitBreakerRegistry,
                                     TimeLimiter timeLimiter,
                                     @Qualifier("signalFetchExecutor") Executor fetchExecutor) {
        this.adapters = adapters;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiter = timeLimiter;
        this.fetchExecutor = fetchExecutor;
    }

    public SignalSourceClient open(String runId) {
        List<SignalSourceAdapter> registered = adapters.orderedStream().toList();
        return new SignalSourceClient(runId, registered, circuitBreakerRegistry, timeLimiter, fetchExecutor);
    }
}
