package com.pulse.forecast.service.backtest;

import com.pulse.forecast.model.TradingAction;

import java.time.Instant;
import java.util.Map;

/**
 * Replay statistics. Returns are percentages per trade; drawdown is measured on the cumulative sum.
 */
public record BacktestMetrics(
        int pairsReplayed,
        int trades,
        int wins,
        double winRate,
        double avgReturn,
        double sharpe,
        double maxDrawdown,
        int excludedLookahead,
        Map<TradingAction, Double> perActionWinRates,
        Instant startTime,
        Instant endTime
) {}
