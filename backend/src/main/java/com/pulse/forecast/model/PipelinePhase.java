package com.pulse.forecast.model;

public enum PipelinePhase {
    MORNING,
    EVENING
}
