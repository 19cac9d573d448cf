package com.pulse.forecast.exception;

import java.time.Instant;

/**
 * No price could be resolved for a horizon that has already elapsed.
 */
public class StalePriceException extends ForecastException {

    private final String symbol;
    private final Instant requestedAt;

    public StalePriceException(String symbol, Instant requestedAt, String message) {
        super(message);
        this.symbol = symbol;
        this.requestedAt = requestedAt;
    }

    public String getSymbol() {
        return symbol;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }
}
