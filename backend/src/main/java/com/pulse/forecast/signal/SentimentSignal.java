package com.pulse.forecast.signal;

import lombok.Builder;

import java.time.Instant;

/**
 * Scored news and social sentiment. Values may be null when the source had nothing to say.
 */
@Builder
public record SentimentSignal(
        Instant observedAt,
        Double score,
        Double confidence,
        Integer articleCount,
        Double socialScore
) implements SourceSignal {

    @Override
    public SourceType sourceType() {
        return SourceType.SENTIMENT;
    }
}
