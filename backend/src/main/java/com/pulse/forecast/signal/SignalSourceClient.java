package com.pulse.forecast.signal;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Signal access for a single phase run. Each fetch is bounded by the time limiter and the source's
 * circuit breaker; a failed or slow source degrades the bundle instead of failing the symbol.
 * Market-wide sources are fetched once and reused for every symbol of the run.
 */
@Slf4j
public class SignalSourceClient implements AutoCloseable {

    private final String runId;
    private final List<SignalSourceAdapter> adapters;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiter timeLimiter;
    private final Executor fetchExecutor;
    private final Map<String, FetchResult> marketCache = new ConcurrentHashMap<>();
    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();
    private volatile boolean closed;

    SignalSourceClient(String runId, List<SignalSourceAdapter> adapters, CircuitBreakerRegistry circuitBreakerRegistry,
                       TimeLimiter timeLimiter, Executor fetchExecutor) {
        this.runId = runId;
        this.adapters = List.copyOf(adapters);
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiter = timeLimiter;
        this.fetchExecutor = fetchExecutor;
    }

    public SignalBundle collect(String symbol, Instant asOf) {
        if (closed) {
            throw new IllegalStateException("Signal client for run " + runId + " is closed");
        }
        Map<SourceType, SourceSignal> signals = new EnumMap<>(SourceType.class);
        Set<SourceType> failed = EnumSet.noneOf(SourceType.class);
        for (SignalSourceAdapter adapter : adapters) {
            if (signals.containsKey(adapter.sourceType())) {
                continue;
            }
            FetchResult result = adapter.symbolScoped()
                    ? fetch(adapter, symbol, asOf)
                    : marketCache.computeIfAbsent(adapter.name(), name -> fetch(adapter, symbol, asOf));
            if (result.failed()) {
                failed.add(adapter.sourceType());
            } else {
                result.signal().ifPresent(signal -> signals.put(adapter.sourceType(), signal));
            }
        }
        failed.removeAll(signals.keySet());
        return new SignalBundle(
                symbol,
                asOf,
                (SentimentSignal) signals.get(SourceType.SENTIMENT),
                (TechnicalSignal) signals.get(SourceType.TECHNICAL),
                (MarketContextSignal) signals.get(SourceType.MARKET_CONTEXT),
                failed);
    }

    private FetchResult fetch(SignalSourceAdapter adapter, String symbol, Instant asOf) {
        fetches.incrementAndGet();
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(adapter.name());
        try {
            Optional<SourceSignal> signal = circuitBreaker.executeCallable(() -> timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> fetchTyped(adapter, symbol, asOf), fetchExecutor)));
            return new FetchResult(signal, false);
        } catch (Exception ex) {
            failures.incrementAndGet();
            log.warn("Signal source degraded source={} type={} symbol={} reason={}",
                    adapter.name(), adapter.sourceType(), symbol, ex.toString());
            return FetchResult.degraded();
        }
    }

    private static Optional<SourceSignal> fetchTyped(SignalSourceAdapter adapter, String symbol, Instant asOf) {
        Optional<? extends SourceSignal> fetched = adapter.fetch(symbol, asOf);
        if (fetched == null || fetched.isEmpty()) {
            return Optional.empty();
        }
        SourceSignal signal = fetched.get();
        if (!adapter.sourceType().signalClass().isInstance(signal)) {
            throw new IllegalStateException("Adapter " + adapter.name() + " returned "
                    + signal.getClass().getSimpleName() + " instead of " + adapter.sourceType());
        }
        return Optional.of(signal);
    }

    public int fetchCount() {
        return fetches.get();
    }

    public int failureCount() {
        return failures.get();
    }

    @Override
    public void close() {
        closed = true;
        marketCache.clear();
        log.info("Signal client closed runId={} fetches={} failures={}", runId, fetches.get(), failures.get());
    }

    private record FetchResult(Optional<SourceSignal> signal, boolean failed) {

        static FetchResult degraded() {
            return new FetchResult(Optional.empty(), true);
        }
    }
}
