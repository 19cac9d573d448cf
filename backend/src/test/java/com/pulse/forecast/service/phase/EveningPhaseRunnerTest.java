package com.pulse.forecast.service.phase;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.dto.PhaseSummary;
import com.pulse.forecast.exception.TemporalIntegrityViolationException;
import com.pulse.forecast.model.EveningAnalysis;
import com.pulse.forecast.model.PipelinePhase;
import com.pulse.forecast.model.RunStatus;
import com.pulse.forecast.repository.EveningAnalysisRepository;
import com.pulse.forecast.service.PipelineMetrics;
import com.pulse.forecast.service.backtest.PromotionDecision;
import com.pulse.forecast.service.backtest.WinRateAnalyzer;
import com.pulse.forecast.service.feature.MarketCalendar;
import com.pulse.forecast.service.guard.GuardCheck;
import com.pulse.forecast.service.guard.GuardReport;
import com.pulse.forecast.service.guard.TemporalIntegrityGuard;
import com.pulse.forecast.service.outcome.OutcomeCollector;
import com.pulse.forecast.service.prediction.ModelTrainingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EveningPhaseRunnerTest {

    private static final Instant AS_OF = Instant.parse("2024-03-13T07:00:00Z");
    private static final LocalDate CYCLE = LocalDate.of(2024, 3, 13);

    private OutcomeCollector outcomeCollector;
    private TemporalIntegrityGuard guard;
    private ModelTrainingService modelTrainingService;
    private WinRateAnalyzer winRateAnalyzer;
    private PhaseStateService phaseStateService;
    private EveningAnalysisRepository analysisRepository;
    private EveningPhaseRunner runner;

    @BeforeEach
    void setUp() {
        outcomeCollector = mock(OutcomeCollector.class);
        guard = mock(TemporalIntegrityGuard.class);
        modelTrainingService = mock(ModelTrainingService.class);
        winRateAnalyzer = mock(WinRateAnalyzer.class);
        phaseStateService = mock(PhaseStateService.class);
        analysisRepository = mock(EveningAnalysisRepository.class);
        when(analysisRepository.save(any(EveningAnalysis.class))).thenAnswer(inv -> inv.getArgument(0));
        when(guard.checkPhaseOrder(CYCLE)).thenReturn(List.of());
        when(outcomeCollector.collect(AS_OF)).thenReturn(new OutcomeCollector.CollectionSummary(3, 2, 1, 1, 1, 0));
        when(guard.enforce(PipelinePhase.EVENING, AS_OF)).thenReturn(new GuardReport(PipelinePhase.EVENING, AS_OF,
                List.of("schema_presence", "phase_order"), List.of()));
        when(winRateAnalyzer.analyze()).thenReturn(new WinRateAnalyzer.WinRateReport(Map.of(), List.of()));
        runner = new EveningPhaseRunner(outcomeCollector, guard, modelTrainingService, winRateAnalyzer,
                phaseStateService, analysisRepository, new MarketCalendar(new ForecastProperties()),
                new PipelineMetrics(new SimpleMeterRegistry()), Jackson2ObjectMapperBuilder.json().build());
    }

    @Test
    void skippedTrainingStillCompletesTheEvening() {
        when(modelTrainingService.retrain(AS_OF)).thenReturn(new ModelTrainingService.TrainingOutcome(true,
                ModelTrainingService.SKIP_INSUFFICIENT_DATA, "Insufficient training data: 12 samples, 50 required",
                null, null, null));

        PhaseSummary summary = runner.run(AS_OF);

        assertThat(summary.getExitCode()).isEqualTo(PhaseSummary.EXIT_OK);
        assertThat(summary.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(summary.isTrainingSkipped()).isTrue();
        assertThat(summary.getTrainingSkipReason()).isEqualTo("insufficient_data");
        assertThat(summary.getModelVersionId()).isNull();
        assertThat(summary.getCounts())
                .containsEntry("outcomesRecorded", 2)
                .containsEntry("outcomesBackfilled", 1)
                .containsEntry("stalePrices", 1)
                .containsEntry("validationPassed", 2);
        verify(phaseStateService).markCompleted(eq(PipelinePhase.EVENING), eq(CYCLE), any(Instant.class));
    }

    @Test
    void missingMorningBlocksBeforeOutcomesAreTouched() {
        when(guard.checkPhaseOrder(CYCLE)).thenReturn(List.of(new GuardReport.Violation(GuardCheck.PHASE_ORDER, 0,
                "morning phase has not completed for cycle " + CYCLE)));

        PhaseSummary summary = runner.run(AS_OF);

        assertThat(summary.getExitCode()).isEqualTo(PhaseSummary.EXIT_BLOCKED);
        assertThat(summary.getViolations()).extracting(GuardReport.Violation::check)
                .containsExactly(GuardCheck.PHASE_ORDER);
        verify(outcomeCollector, never()).collect(any());
        verify(modelTrainingService, never()).retrain(any());
        verify(phaseStateService, never()).markCompleted(any(), any(), any());
    }

    @Test
    void guardFailureAfterCollectionSkipsTraining() {
        GuardReport failed = GuardReport.of(PipelinePhase.EVENING, AS_OF, List.of(
                new GuardReport.Violation(GuardCheck.OUTCOME_LOOKAHEAD, 1, "CBA.AX 1d exit before horizon")));
        when(guard.enforce(PipelinePhase.EVENING, AS_OF)).thenThrow(new TemporalIntegrityViolationException(failed));

        PhaseSummary summary = runner.run(AS_OF);

        assertThat(summary.getExitCode()).isEqualTo(PhaseSummary.EXIT_BLOCKED);
        assertThat(summary.getStatus()).isEqualTo(RunStatus.BLOCKED);
        assertThat(summary.getCounts()).containsEntry("outcomesRecorded", 2).containsEntry("validationFailed", 1);
        verify(modelTrainingService, never()).retrain(any());
        verify(phaseStateService, never()).markCompleted(any(), any(), any());
    }

    @Test
    void promotedModelIsReported() {
        PromotionDecision decision = new PromotionDecision("fm-20240313T070000-0badcafe",
                PromotionDecision.Result.PROMOTED, "passed");
        when(modelTrainingService.retrain(AS_OF)).thenReturn(new ModelTrainingService.TrainingOutcome(false, null,
                null, decision.versionId(), decision, null));
        when(winRateAnalyzer.analyze()).thenReturn(new WinRateAnalyzer.WinRateReport(Map.of(),
                List.of("BUY win rate 100% over 30 samples")));

        PhaseSummary summary = runner.run(AS_OF);

        assertThat(summary.getExitCode()).isEqualTo(PhaseSummary.EXIT_OK);
        assertThat(summary.getModelVersionId()).isEqualTo("fm-20240313T070000-0badcafe");
        assertThat(summary.getPromotionResult()).isEqualTo("PROMOTED");
        assertThat(summary.getAnomalies()).containsExactly("BUY win rate 100% over 30 samples");
        ArgumentCaptor<EveningAnalysis> saved = ArgumentCaptor.forClass(EveningAnalysis.class);
        verify(analysisRepository, atLeastOnce()).save(saved.capture());
        assertThat(saved.getValue().getWinRateJson()).contains("anomalies");
    }

    @Test
    void unexpectedErrorFailsThePhase() {
        when(outcomeCollector.collect(AS_OF)).thenThrow(new IllegalStateException("price feed offline"));

        PhaseSummary summary = runner.run(AS_OF);

        assertThat(summary.getExitCode()).isEqualTo(PhaseSummary.EXIT_FAILED);
        assertThat(summary.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(summary.getErrorMessage()).contains("price feed offline");
    }
}
