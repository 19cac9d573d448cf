package com.pulse.forecast.exception;

public class ModelUnavailableException extends ForecastException {
    public ModelUnavailableException(String message) {
        super(message);
    }
}
