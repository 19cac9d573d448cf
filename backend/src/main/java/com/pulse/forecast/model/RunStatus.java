package com.pulse.forecast.model;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    BLOCKED,
    FAILED
}
