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
@Table(name = "morning_analysis")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MorningAnalysis {

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

    private int symbolsRequested;
    private int symbolsAnalyzed;
    private int featuresCreated;
    private int predictionsMade;
    private int duplicatesRejected;
    private int incompleteSignals;
    private int modelUnavailable;
    private int symbolsFailed;
    private int validationPassed;
    private int validationFailed;

    @Column(columnDefinition = "TEXT")
    private String violationsJson;

    @Column(columnDefinition = "TEXT")
    private String actionCountsJson;

    @Column(length = 2000)
    private String errorMessage;
}
