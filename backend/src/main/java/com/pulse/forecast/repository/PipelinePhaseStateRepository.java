package com.pulse.forecast.repository;

import com.pulse.forecast.model.PipelinePhaseState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;

public interface PipelinePhaseStateRepository extends JpaRepository<PipelinePhaseState, Long> {
    Optional<PipelinePhaseState> findByCycleDate(LocalDate cycleDate);
}
