package com.pulse.forecast.repository;

import com.pulse.forecast.model.MorningAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface MorningAnalysisRepository extends JpaRepository<MorningAnalysis, Long> {
    Optional<MorningAnalysis> findTopByOrderByIdDesc();
}
