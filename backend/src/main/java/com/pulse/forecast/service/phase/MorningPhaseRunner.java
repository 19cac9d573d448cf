package com.pulse.forecast.service.phase;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.dto.PhaseSummary;
import com.pulse.forecast.exception.DuplicatePredictionException;
import com.pulse.forecast.exception.IncompleteSignalException;
import com.pulse.forecast.exception.ModelUnavailableException;
import com.pulse.forecast.exception.TemporalIntegrityViolationException;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.MorningAnalysis;
import com.pulse.forecast.model.PipelinePhase;
import com.pulse.forecast.model.Prediction;
import com.pulse.forecast.model.RunStatus;
import com.pulse.forecast.model.TradingAction;
import com.pulse.forecast.repository.MorningAnalysisRepository;
import com.pulse.forecast.repository.PredictionRepository;
import com.pulse.forecast.service.PipelineMetrics;
import com.pulse.forecast.service.feature.FeatureEngineer;
import com.pulse.forecast.service.feature.MarketCalendar;
import com.pulse.forecast.service.guard.GuardReport;
import com.pulse.forecast.service.guard.TemporalIntegrityGuard;
import com.pulse.forecast.service.prediction.MultiOutputPredictor;
import com.pulse.forecast.signal.SignalSourceClient;
import com.pulse.forecast.signal.SignalSourceClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Morning phase: guard, then features and predictions for every configured symbol. Symbols run in
 * parallel and each one commits on its own, so an interrupted run can simply be started again.
 */
@Slf4j
@Service
public class MorningPhaseRunner {

    private final TemporalIntegrityGuard temporalIntegrityGuard;
    private final SignalSourceClientFactory signalSourceClientFactory;
    private final FeatureEngineer featureEngineer;
    private final MultiOutputPredictor multiOutputPredictor;
    private final PredictionRepository predictionRepository;
    private final MorningAnalysisRepository morningAnalysisRepository;
    private final PhaseStateService phaseStateService;
    private final MarketCalendar marketCalendar;
    private final PipelineMetrics pipelineMetrics;
    private final ForecastProperties forecastProperties;
    private final ObjectMapper objectMapper;
    private final Executor featureExecutor;

    public MorningPhaseRunner(TemporalIntegrityGuard temporalIntegrityGuard,
                              SignalSourceClientFactory signalSourceClientFactory,
                              FeatureEngineer featureEngineer,
                              MultiOutputPredictor multiOutputPredictor,
                              PredictionRepository predictionRepository,
                              MorningAnalysisRepository morningAnalysisRepository,
                              PhaseStateService phaseStateService,
                              MarketCalendar marketCalendar,
                              PipelineMetrics pipelineMetrics,
                              ForecastProperties forecastProperties,
                              ObjectMapper objectMapper,
                              @Qualifier("featureExecutor") Executor featureExecutor) {
        this.temporalIntegrityGuard = temporalIntegrityGuard;
        this.signalSourceClientFactory = signalSourceClientFactory;
        this.featureEngineer = featureEngineer;
        this.multiOutputPredictor = multiOutputPredictor;
        this.predictionRepository = predictionRepository;
        this.morningAnalysisRepository = morningAnalysisRepository;
        this.phaseStateService = phaseStateService;
        this.marketCalendar = marketCalendar;
        this.pipelineMetrics = pipelineMetrics;
        this.forecastProperties = forecastProperties;
        this.objectMapper = objectMapper;
        this.featureExecutor = featureExecutor;
    }

    public PhaseSummary run(Instant asOf) {
        String runId = "morning-" + UUID.randomUUID();
        LocalDate cycleDate = marketCalendar.cycleDate(asOf);
        List<String> symbols = forecastProperties.getPipeline().getSymbols();
        MDC.put("runId", runId);
        MDC.put("phase", PipelinePhase.MORNING.name());
        MorningAnalysis analysis = morningAnalysisRepository.save(MorningAnalysis.builder()
                .runId(runId)
                .cycleDate(cycleDate)
                .startedAt(Instant.now())
                .status(RunStatus.RUNNING)
                .symbolsRequested(symbols.size())
                .build());
        log.info("Morning phase started runId={} cycle={} asOf={} symbols={}", runId, cycleDate, asOf, symbols.size());
        PhaseSummary summary = PhaseSummary.builder()
                .runId(runId)
                .phase(PipelinePhase.MORNING)
                .cycleDate(cycleDate)
                .startedAt(analysis.getStartedAt())
                .build();
        try {
            GuardReport report = temporalIntegrityGuard.enforce(PipelinePhase.MORNING, asOf);
            analysis.setValidationPassed(report.passedCount());
            analysis.setValidationFailed(report.failedCount());

            List<SymbolOutcome> outcomes = processSymbols(runId, symbols, cycleDate, asOf);
            tally(analysis, outcomes);
            List<GuardReport.Violation> leaks = outcomes.stream()
                    .filter(outcome -> outcome.violation() != null)
                    .map(SymbolOutcome::violation)
                    .toList();
            if (!leaks.isEmpty()) {
                throw new TemporalIntegrityViolationException(GuardReport.of(PipelinePhase.MORNING, asOf, leaks));
            }
            phaseStateService.markCompleted(PipelinePhase.MORNING, cycleDate, Instant.now());
            analysis.setStatus(RunStatus.COMPLETED);
            summary.setExitCode(PhaseSummary.EXIT_OK);
        } catch (TemporalIntegrityViolationException ex) {
            GuardReport report = ex.getReport();
            log.error("Morning phase blocked runId={} violations={}", runId, report.describe());
            pipelineMetrics.recordGuard(report);
            analysis.setStatus(RunStatus.BLOCKED);
            analysis.setValidationFailed(Math.max(analysis.getValidationFailed(), report.failedCount()));
            analysis.setViolationsJson(writeJson(report.violations()));
            analysis.setErrorMessage(truncate(ex.getMessage()));
            summary.setViolations(report.violations());
            summary.setErrorMessage(ex.getMessage());
            summary.setExitCode(PhaseSummary.EXIT_BLOCKED);
        } catch (RuntimeException ex) {
            log.error("Morning phase failed runId={}", runId, ex);
            analysis.setStatus(RunStatus.FAILED);
            analysis.setErrorMessage(truncate(ex.getMessage()));
            summary.setErrorMessage(ex.getMessage());
            summary.setExitCode(PhaseSummary.EXIT_FAILED);
        } finally {
            analysis.setCompletedAt(Instant.now());
            morningAnalysisRepository.save(analysis);
            pipelineMetrics.recordPhase(PipelinePhase.MORNING, analysis.getStatus());
            log.info("Morning phase finished runId={} status={} predictions={} incomplete={} modelUnavailable={}",
                    runId, analysis.getStatus(), analysis.getPredictionsMade(), analysis.getIncompleteSignals(),
                    analysis.getModelUnavailable());
            MDC.remove("runId");
            MDC.remove("phase");
        }
        summary.setStatus(analysis.getStatus());
        summary.setCompletedAt(analysis.getCompletedAt());
        summary.setCounts(counts(analysis));
        return summary;
    }

    private List<SymbolOutcome> processSymbols(String runId, List<String> symbols, LocalDate cycleDate, Instant asOf) {
        long timeoutSeconds = forecastProperties.getPipeline().getSymbolTimeoutSeconds();
        List<SymbolOutcome> outcomes = new ArrayList<>();
        try (SignalSourceClient client = signalSourceClientFactory.open(runId)) {
            Map<String, CompletableFuture<SymbolOutcome>> futures = new LinkedHashMap<>();
            for (String symbol : symbols) {
                futures.put(symbol, CompletableFuture.supplyAsync(
                        () -> processSymbol(client, runId, symbol, cycleDate, asOf), featureExecutor));
            }
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
            for (Map.Entry<String, CompletableFuture<SymbolOutcome>> entry : futures.entrySet()) {
                outcomes.add(await(entry.getKey(), entry.getValue(), deadline));
            }
            log.info("Signal fetches runId={} total={} degraded={}", runId, client.fetchCount(), client.failureCount());
        }
        return outcomes;
    }

    private SymbolOutcome await(String symbol, CompletableFuture<SymbolOutcome> future, long deadline) {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.error("Symbol timed out symbol={}", symbol);
            return SymbolOutcome.of(symbol, SymbolResult.FAILED);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Morning phase interrupted", ex);
        } catch (ExecutionException ex) {
            log.error("Symbol task failed symbol={}", symbol, ex.getCause());
            return SymbolOutcome.of(symbol, SymbolResult.FAILED);
        }
    }

    SymbolOutcome processSymbol(SignalSourceClient client, String runId, String symbol, LocalDate cycleDate, Instant asOf) {
        MDC.put("runId", runId);
        MDC.put("phase", PipelinePhase.MORNING.name());
        MDC.put("symbol", symbol);
        FeatureEngineer.BuildResult built = null;
        try {
            if (predictionRepository.existsBySymbolAndPredictionDate(symbol, cycleDate)) {
                log.info("Prediction already stored, skipping symbol={} cycle={}", symbol, cycleDate);
                return record(SymbolOutcome.of(symbol, SymbolResult.ALREADY_PREDICTED));
            }
            built = featureEngineer.findOrBuild(symbol, cycleDate,
                    () -> client.collect(symbol, asOf));
            FeatureRecord feature = built.record();
            Prediction prediction = multiOutputPredictor.predictAndSave(feature);
            return record(new SymbolOutcome(symbol, SymbolResult.PREDICTED, built.created(), true,
                    prediction.getOptimalAction(), null));
        } catch (IncompleteSignalException ex) {
            log.warn("Incomplete signals, symbol discarded reason={}", ex.getMessage());
            return record(SymbolOutcome.of(symbol, SymbolResult.INCOMPLETE_SIGNAL));
        } catch (ModelUnavailableException ex) {
            log.warn("No usable model, feature kept without prediction reason={}", ex.getMessage());
            return record(new SymbolOutcome(symbol, SymbolResult.MODEL_UNAVAILABLE, created(built), true, null, null));
        } catch (DuplicatePredictionException ex) {
            log.warn("Duplicate prediction rejected reason={}", ex.getMessage());
            return record(new SymbolOutcome(symbol, SymbolResult.DUPLICATE, created(built), true, null, null));
        } catch (TemporalIntegrityViolationException ex) {
            log.error("Feature rejected for leakage reason={}", ex.getMessage());
            GuardReport.Violation violation = ex.getReport().violations().isEmpty()
                    ? null : ex.getReport().violations().get(0);
            return record(new SymbolOutcome(symbol, SymbolResult.LEAKAGE, false, false, null, violation));
        } catch (RuntimeException ex) {
            log.error("Symbol processing failed", ex);
            return record(new SymbolOutcome(symbol, SymbolResult.FAILED, created(built), false, null, null));
        } finally {
            MDC.remove("symbol");
            MDC.remove("runId");
            MDC.remove("phase");
        }
    }

    private boolean created(FeatureEngineer.BuildResult built) {
        return built != null && built.created();
    }

    private SymbolOutcome record(SymbolOutcome outcome) {
        pipelineMetrics.recordSymbol(outcome.result().name());
        return outcome;
    }

    private void tally(MorningAnalysis analysis, List<SymbolOutcome> outcomes) {
        Map<TradingAction, Integer> actions = new EnumMap<>(TradingAction.class);
        for (SymbolOutcome outcome : outcomes) {
            if (outcome.analyzed()) {
                analysis.setSymbolsAnalyzed(analysis.getSymbolsAnalyzed() + 1);
            }
            if (outcome.featureCreated()) {
                analysis.setFeaturesCreated(analysis.getFeaturesCreated() + 1);
            }
            switch (outcome.result()) {
                case PREDICTED -> {
                    analysis.setPredictionsMade(analysis.getPredictionsMade() + 1);
                    actions.merge(outcome.action(), 1, Integer::sum);
                }
                case ALREADY_PREDICTED, DUPLICATE -> analysis.setDuplicatesRejected(analysis.getDuplicatesRejected() + 1);
                case INCOMPLETE_SIGNAL -> analysis.setIncompleteSignals(analysis.getIncompleteSignals() + 1);
                case MODEL_UNAVAILABLE -> analysis.setModelUnavailable(analysis.getModelUnavailable() + 1);
                case LEAKAGE, FAILED -> analysis.setSymbolsFailed(analysis.getSymbolsFailed() + 1);
            }
        }
        analysis.setActionCountsJson(writeJson(actions));
    }

    private Map<String, Integer> counts(MorningAnalysis analysis) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("symbolsRequested", analysis.getSymbolsRequested());
        counts.put("symbolsAnalyzed", analysis.getSymbolsAnalyzed());
        counts.put("featuresCreated", analysis.getFeaturesCreated());
        counts.put("predictionsMade", analysis.getPredictionsMade());
        counts.put("duplicatesRejected", analysis.getDuplicatesRejected());
        counts.put("incompleteSignals", analysis.getIncompleteSignals());
        counts.put("modelUnavailable", analysis.getModelUnavailable());
        counts.put("symbolsFailed", analysis.getSymbolsFailed());
        counts.put("validationPassed", analysis.getValidationPassed());
        counts.put("validationFailed", analysis.getValidationFailed());
        return counts;
    }

    private String writeJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            log.warn("Failed to serialize morning payload: {}", e.getMessage());
            return "{}";
        }
    }

    private String truncate(String message) {
        if (message == null || message.length() <= 2000) {
            return message;
        }
        return message.substring(0, 2000);
    }

    enum SymbolResult {
        PREDICTED,
        ALREADY_PREDICTED,
        INCOMPLETE_SIGNAL,
        MODEL_UNAVAILABLE,
        DUPLICATE,
        LEAKAGE,
        FAILED
    }

    record SymbolOutcome(String symbol, SymbolResult result, boolean featureCreated, boolean analyzed,
                         TradingAction action, GuardReport.Violation violation) {

        static SymbolOutcome of(String symbol, SymbolResult result) {
            return new SymbolOutcome(symbol, result, false, false, null, null);
        }
    }
}
