package com.pulse.forecast.model;

public enum TradingAction {
    STRONG_BUY,
    BUY,
    HOLD,
    SELL,
    STRONG_SELL;

    public boolean isLong() {
        return this == STRONG_BUY || this == BUY;
    }

    public boolean isShort() {
        return this == STRONG_SELL || this == SELL;
    }

    public boolean trades() {
        return this != HOLD;
    }
}
