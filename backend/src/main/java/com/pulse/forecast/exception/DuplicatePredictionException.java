package com.pulse.forecast.exception;

import java.time.LocalDate;

public class DuplicatePredictionException extends ForecastException {
    public DuplicatePredictionException(String symbol, LocalDate predictionDate, Throwable cause) {
        super("Prediction already stored for " + symbol + " on " + predictionDate, cause);
    }
}
