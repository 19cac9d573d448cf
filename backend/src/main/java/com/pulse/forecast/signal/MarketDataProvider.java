package com.pulse.forecast.signal;

import com.pulse.forecast.model.Candle;

import java.util.List;

/**
 * Port to a candle history feed, oldest candle first.
 */
public interface MarketDataProvider {
    List<Candle> getCandles(String symbol, String timeframe, int bars);
}
