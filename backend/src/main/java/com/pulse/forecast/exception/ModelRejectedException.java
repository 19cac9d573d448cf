package com.pulse.forecast.exception;

public class ModelRejectedException extends ForecastException {

    private final String versionId;

    public ModelRejectedException(String versionId, String reason) {
        super("Model " + versionId + " rejected: " + reason);
        this.versionId = versionId;
    }

    public String getVersionId() {
        return versionId;
    }
}
