package com.pulse.forecast.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "pipeline_phase_state",
        uniqueConstraints = @UniqueConstraint(columnNames = {"cycle_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelinePhaseState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDate cycleDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelinePhase lastCompletedPhase;

    @Column(nullable = false)
    private Instant phaseTimestamp;
}
