package com.pulse.forecast.exception;

public class InsufficientDataException extends ForecastException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super("Insufficient training data: " + available + " samples, " + required + " required");
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
