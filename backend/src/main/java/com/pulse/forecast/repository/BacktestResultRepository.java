package com.pulse.forecast.repository;

import com.pulse.forecast.model.BacktestResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BacktestResultRepository extends JpaRepository<BacktestResult, Long> {
    List<BacktestResult> findByModelVersionIdOrderByCreatedAtDesc(String modelVersionId);
}
