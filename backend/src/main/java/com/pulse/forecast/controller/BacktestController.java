package com.pulse.forecast.controller;

import com.pulse.forecast.model.BacktestResult;
import com.pulse.forecast.repository.BacktestResultRepository;
import com.pulse.forecast.service.backtest.BacktestEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/backtest")
@RequiredArgsConstructor
public class BacktestController {

    private final BacktestEngine backtestEngine;
    private final BacktestResultRepository backtestResultRepository;

    @PostMapping("/{versionId}")
    public BacktestEngine.BacktestRun run(@PathVariable String versionId) {
        return backtestEngine.run(versionId);
    }

    @GetMapping("/{versionId}/runs")
    public List<BacktestRunSummary> runs(@PathVariable String versionId) {
        return backtestResultRepository.findByModelVersionIdOrderByCreatedAtDesc(versionId).stream()
                .map(BacktestRunSummary::from)
                .toList();
    }

    public record BacktestRunSummary(Long id, String modelVersionId, Instant startTime, Instant endTime,
                                     String metricsJson, Instant createdAt) {

        static BacktestRunSummary from(BacktestResult result) {
            return new BacktestRunSummary(result.getId(), result.getModelVersionId(), result.getStartTime(),
                    result.getEndTime(), result.getMetricsJson(), result.getCreatedAt());
        }
    }
}
