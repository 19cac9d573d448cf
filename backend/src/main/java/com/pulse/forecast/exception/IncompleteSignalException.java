package com.pulse.forecast.exception;

/**
 * A mandatory signal input (symbol, timestamp or every technical field) was missing.
 */
public class IncompleteSignalException extends ForecastException {

    private final String symbol;

    public IncompleteSignalException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
