package com.pulse.forecast.dto;

import com.pulse.forecast.model.PipelinePhase;
import com.pulse.forecast.model.RunStatus;
import com.pulse.forecast.service.guard.GuardReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Machine-readable result of one phase run. {@code exitCode} is 0 on success, 2 when the integrity
 * guard blocked the phase and 1 on any other failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseSummary {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_BLOCKED = 2;

    private String runId;
    private PipelinePhase phase;
    private LocalDate cycleDate;
    private RunStatus status;
    private int exitCode;
    private Instant startedAt;
    private Instant completedAt;
    @Builder.Default
    private Map<String, Integer> counts = new LinkedHashMap<>();
    @Builder.Default
    private List<GuardReport.Violation> violations = List.of();
    private boolean trainingSkipped;
    private String trainingSkipReason;
    private String modelVersionId;
    private String promotionResult;
    @Builder.Default
    private List<String> anomalies = List.of();
    private String errorMessage;
}
