package com.pulse.forecast.signal;

public enum SourceType {
    SENTIMENT(SentimentSignal.class),
    TECHNICAL(TechnicalSignal.class),
    MARKET_CONTEXT(MarketContextSignal.class);

    private final Class<? extends SourceSignal> signalClass;

    SourceType(Class<? extends SourceSignal> signalClass) {
        this.signalClass = signalClass;
    }

    public Class<? extends SourceSignal> signalClass() {
        return signalClass;
    }
}
