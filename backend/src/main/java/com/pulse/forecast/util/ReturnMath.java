package com.pulse.forecast.util;

/**
 * The single return formula used for every stored return: {@code ((exit - entry) / entry) * 100}.
 * Results are percentages, so a move from 100 to 105 is 5.0, not 0.05 or 500.
 */
public final class ReturnMath {

    private ReturnMath() {
    }

    public static double returnPct(double entry, double exit) {
        if (!Double.isFinite(entry) || entry <= 0) {
            throw new IllegalArgumentException("Entry price must be positive and finite: " + entry);
        }
        if (!Double.isFinite(exit) || exit < 0) {
            throw new IllegalArgumentException("Exit price must be non-negative and finite: " + exit);
        }
        return ((exit - entry) / entry) * 100.0;
    }

    public static boolean consistent(double storedReturnPct, double entry, double exit, double tolerance) {
        return Math.abs(storedReturnPct - returnPct(entry, exit)) <= tolerance;
    }
}
