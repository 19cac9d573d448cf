package com.pulse.forecast.model;

/**
 * Direction classes. The ordinal is the class index used by the models.
 */
public enum Direction {
    UP,
    DOWN,
    FLAT;

    public static final int CLASS_COUNT = 3;

    public static Direction fromIndex(int index) {
        return values()[index];
    }

    public int index() {
        return ordinal();
    }

    /**
     * Labels a percentage return, treating anything within the flat band as FLAT.
     */
    public static Direction ofReturn(double returnPct, double flatBandPct) {
        if (returnPct > flatBandPct) {
            return UP;
        }
        if (returnPct < -flatBandPct) {
            return DOWN;
        }
        return FLAT;
    }
}
