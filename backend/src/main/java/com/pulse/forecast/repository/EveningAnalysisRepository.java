package com.pulse.forecast.repository;

import com.pulse.forecast.model.EveningAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface EveningAnalysisRepository extends JpaRepository<EveningAnalysis, Long> {
    Optional<EveningAnalysis> findTopByOrderByIdDesc();
}
