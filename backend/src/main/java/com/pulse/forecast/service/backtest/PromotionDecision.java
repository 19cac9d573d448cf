package com.pulse.forecast.service.backtest;

public record PromotionDecision(String versionId, Result result, String reason) {

    public enum Result {
        PROMOTED,
        REJECTED
    }

    public boolean promoted() {
        return result == Result.PROMOTED;
    }
}
