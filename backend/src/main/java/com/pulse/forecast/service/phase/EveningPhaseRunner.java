package com.pulse.forecast.service.phase;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.forecast.dto.PhaseSummary;
import com.pulse.forecast.exception.TemporalIntegrityViolationException;
import com.pulse.forecast.model.EveningAnalysis;
import com.pulse.forecast.model.PipelinePhase;
import com.pulse.forecast.model.RunStatus;
import com.pulse.forecast.repository.EveningAnalysisRepository;
import com.pulse.forecast.service.PipelineMetrics;
import com.pulse.forecast.service.backtest.WinRateAnalyzer;
import com.pulse.forecast.service.feature.MarketCalendar;
import com.pulse.forecast.service.guard.GuardReport;
import com.pulse.forecast.service.guard.TemporalIntegrityGuard;
import com.pulse.forecast.service.outcome.OutcomeCollector;
import com.pulse.forecast.service.prediction.ModelTrainingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Evening phase: record outcomes, verify the store, retrain behind the promotion gate and advance
 * the phase state. Nothing runs for a cycle whose morning has not completed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EveningPhaseRunner {

    private final OutcomeCollector outcomeCollector;
    private final TemporalIntegrityGuard temporalIntegrityGuard;
    private final ModelTrainingService modelTrainingService;
    private final WinRateAnalyzer winRateAnalyzer;
    private final PhaseStateService phaseStateService;
    private final EveningAnalysisRepository eveningAnalysisRepository;
    private final MarketCalendar marketCalendar;
    private final PipelineMetrics pipelineMetrics;
    private final ObjectMapper objectMapper;

    public PhaseSummary run(Instant asOf) {
        String runId = "evening-" + UUID.randomUUID();
        LocalDate cycleDate = marketCalendar.cycleDate(asOf);
        MDC.put("runId", runId);
        MDC.put("phase", PipelinePhase.EVENING.name());
        EveningAnalysis analysis = eveningAnalysisRepository.save(EveningAnalysis.builder()
                .runId(runId)
                .cycleDate(cycleDate)
                .startedAt(Instant.now())
                .status(RunStatus.RUNNING)
                .build());
        log.info("Evening phase started runId={} cycle={} asOf={}", runId, cycleDate, asOf);
        PhaseSummary summary = PhaseSummary.builder()
                .runId(runId)
                .phase(PipelinePhase.EVENING)
                .cycleDate(cycleDate)
                .startedAt(analysis.getStartedAt())
                .build();
        try {
            List<GuardReport.Violation> order = temporalIntegrityGuard.checkPhaseOrder(cycleDate);
            if (!order.isEmpty()) {
                throw new TemporalIntegrityViolationException(GuardReport.of(PipelinePhase.EVENING, asOf, order));
            }

            OutcomeCollector.CollectionSummary collection = outcomeCollector.collect(asOf);
            analysis.setOutcomesRecorded(collection.recorded());
            analysis.setOutcomesBackfilled(collection.backfilled());
            analysis.setOutcomesPending(collection.pending());
            analysis.setStalePrices(collection.stalePrices());
            pipelineMetrics.recordOutcomes(collection.recorded(), collection.backfilled(), collection.stalePrices());

            GuardReport report = temporalIntegrityGuard.enforce(PipelinePhase.EVENING, asOf);
            analysis.setValidationPassed(report.passedCount());
            analysis.setValidationFailed(report.failedCount());

            ModelTrainingService.TrainingOutcome training = modelTrainingService.retrain(asOf);
            analysis.setTrainingSkipped(training.skipped());
            analysis.setTrainingSkipReason(training.skipReason());
            analysis.setModelVersionId(training.versionId());
            if (training.decision() != null) {
                analysis.setPromotionResult(training.decision().result().name());
            }
            pipelineMetrics.recordTraining(training.skipped() ? training.skipReason() : analysis.getPromotionResult());

            WinRateAnalyzer.WinRateReport winRates = winRateAnalyzer.analyze();
            analysis.setWinRateJson(writeJson(winRates));
            summary.setAnomalies(winRates.anomalies());

            phaseStateService.markCompleted(PipelinePhase.EVENING, cycleDate, Instant.now());
            analysis.setStatus(RunStatus.COMPLETED);
            summary.setExitCode(PhaseSummary.EXIT_OK);
        } catch (TemporalIntegrityViolationException ex) {
            GuardReport report = ex.getReport();
            log.error("Evening phase blocked runId={} violations={}", runId, report.describe());
            pipelineMetrics.recordGuard(report);
            analysis.setStatus(RunStatus.BLOCKED);
            analysis.setValidationPassed(report.passedCount());
            analysis.setValidationFailed(report.failedCount());
            analysis.setViolationsJson(writeJson(report.violations()));
            analysis.setErrorMessage(truncate(ex.getMessage()));
            summary.setViolations(report.violations());
            summary.setErrorMessage(ex.getMessage());
            summary.setExitCode(PhaseSummary.EXIT_BLOCKED);
        } catch (RuntimeException ex) {
            log.error("Evening phase failed runId={}", runId, ex);
            analysis.setStatus(RunStatus.FAILED);
            analysis.setErrorMessage(truncate(ex.getMessage()));
            summary.setErrorMessage(ex.getMessage());
            summary.setExitCode(PhaseSummary.EXIT_FAILED);
        } finally {
            analysis.setCompletedAt(Instant.now());
            eveningAnalysisRepository.save(analysis);
            pipelineMetrics.recordPhase(PipelinePhase.EVENING, analysis.getStatus());
            log.info("Evening phase finished runId={} status={} recorded={} pending={} trainingSkipped={}",
                    runId, analysis.getStatus(), analysis.getOutcomesRecorded(), analysis.getOutcomesPending(),
                    analysis.isTrainingSkipped());
            MDC.remove("runId");
            MDC.remove("phase");
        }
        summary.setStatus(analysis.getStatus());
        summary.setCompletedAt(analysis.getCompletedAt());
        summary.setTrainingSkipped(analysis.isTrainingSkipped());
        summary.setTrainingSkipReason(analysis.getTrainingSkipReason());
        summary.setModelVersionId(analysis.getModelVersionId());
        summary.setPromotionResult(analysis.getPromotionResult());
        summary.setCounts(counts(analysis));
        return summary;
    }

    private Map<String, Integer> counts(EveningAnalysis analysis) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("outcomesRecorded", analysis.getOutcomesRecorded());
        counts.put("outcomesBackfilled", analysis.getOutcomesBackfilled());
        counts.put("outcomesPending", analysis.getOutcomesPending());
        counts.put("stalePrices", analysis.getStalePrices());
        counts.put("validationPassed", analysis.getValidationPassed());
        counts.put("validationFailed", analysis.getValidationFailed());
        return counts;
    }

    private String writeJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            log.warn("Failed to serialize evening payload: {}", e.getMessage());
            return "{}";
        }
    }

    private String truncate(String message) {
        if (message == null || message.length() <= 2000) {
            return message;
        }
        return message.substring(0, 2000);
    }
}
