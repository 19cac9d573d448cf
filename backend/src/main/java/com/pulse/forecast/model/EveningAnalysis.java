package com.pulse.forecast.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "evening_analysis")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EveningAnalysis {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String runId;

    @Column(nullable = false)
    private LocalDate cycleDate;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status;

    private int outcomesRecorded;
    private int outcomesBackfilled;
    private int outcomesPending;
    private int stalePrices;
    private int validationPassed;
    private int validationFailed;

    @Column(columnDefinition = "TEXT")
    private String violationsJson;

    private boolean trainingSkipped;

    private String trainingSkipReason;

    @Column(length = 64)
    private String modelVersionId;

    @Column(length = 16)
    private String promotionResult;

    @Column(columnDefinition = "TEXT")
    private String winRateJson;

    @Column(length = 2000)
    private String errorMessage;
}
