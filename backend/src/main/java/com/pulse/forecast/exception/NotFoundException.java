package com.pulse.forecast.exception;

public class NotFoundException extends ForecastException {
    public NotFoundException(String message) {
        super(message);
    }
}
