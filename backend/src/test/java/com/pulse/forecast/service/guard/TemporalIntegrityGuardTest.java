package com.pulse.forecast.service.guard;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.exception.TemporalIntegrityViolationException;
import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.Outcome;
import com.pulse.forecast.model.PipelinePhase;
import com.pulse.forecast.model.PipelinePhaseState;
import com.pulse.forecast.model.Prediction;
import com.pulse.forecast.model.TradingAction;
import com.pulse.forecast.repository.FeatureRecordRepository;
import com.pulse.forecast.repository.OutcomeRepository;
import com.pulse.forecast.repository.PipelinePhaseStateRepository;
import com.pulse.forecast.repository.PredictionRepository;
import com.pulse.forecast.service.feature.MarketCalendar;
import com.pulse.forecast.util.TestFeatureFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({TemporalIntegrityGuard.class, MarketCalendar.class, ForecastProperties.class})
class TemporalIntegrityGuardTest {

    // 10:00 on Wednesday 13 March in Sydney
    private static final Instant MORNING = Instant.parse("2024-03-12T23:00:00Z");
    private static final Instant EVENING = Instant.parse("2024-03-13T07:00:00Z");
    private static final LocalDate CYCLE = LocalDate.of(2024, 3, 13);

    @Autowired
    private TemporalIntegrityGuard guard;

    @Autowired
    private FeatureRecordRepository featureRecordRepository;

    @Autowired
    private OutcomeRepository outcomeRepository;

    @Autowired
    private PredictionRepository predictionRepository;

    @Autowired
    private PipelinePhaseStateRepository phaseStateRepository;

    @Test
    void cleanStorePassesEveryMorningCheck() {
        FeatureRecord yesterday = feature("CBA.AX", MORNING.minus(Duration.ofDays(1)));
        outcomeRepository.saveAndFlush(TestFeatureFactory.completeOutcome(yesterday, 100.0, 100.5, 101.0, 102.0));
        predictionRepository.saveAndFlush(TestFeatureFactory.prediction(yesterday, TradingAction.BUY, Direction.UP));

        GuardReport report = guard.inspect(PipelinePhase.MORNING, MORNING);

        assertThat(report.passed()).isTrue();
        assertThat(report.checksRun()).hasSize(7).doesNotContain(GuardCheck.PHASE_ORDER.checkName());
        assertThat(report.passedCount()).isEqualTo(7);
    }

    @Test
    void migratedSchemaHasRequiredColumnsAndUniqueIndexes() {
        assertThat(guard.checkSchemaPresence()).isEmpty();
        assertThat(guard.checkReferentialIntegrity()).isEmpty();
    }

    @Test
    void maturedFeatureWithoutOutcomeFailsTheEvening() {
        phaseStateRepository.saveAndFlush(PipelinePhaseState.builder()
                .cycleDate(CYCLE)
                .lastCompletedPhase(PipelinePhase.MORNING)
                .phaseTimestamp(MORNING)
                .build());
        feature("CBA.AX", MORNING.minus(Duration.ofHours(1)));

        GuardReport report = guard.inspect(PipelinePhase.EVENING, EVENING);

        assertThat(report.passed()).isFalse();
        assertThat(report.violations())
                .extracting(GuardReport.Violation::check)
                .containsExactly(GuardCheck.FEATURE_OUTCOME_COUNT);
        assertThat(report.violations().get(0).affectedRows()).isEqualTo(1);
        assertThat(report.failedCount()).isEqualTo(1);
    }

    @Test
    void morningIgnoresFeaturesOfTheCurrentCycle() {
        feature("CBA.AX", MORNING.minus(Duration.ofHours(2)));

        assertThat(guard.checkFeatureOutcomeCount(PipelinePhase.MORNING, MORNING)).isEmpty();
        assertThat(guard.checkFeatureOutcomeCount(PipelinePhase.EVENING, MORNING)).hasSize(1);
    }

    @Test
    void signalObservedAfterFeatureIsLeakage() {
        FeatureRecord feature = TestFeatureFactory.feature("CBA.AX", MORNING);
        feature.setSentimentObservedAt(MORNING.plus(Duration.ofMinutes(5)));
        featureRecordRepository.saveAndFlush(feature);

        assertThat(guard.checkNoFutureLeakage())
                .singleElement()
                .satisfies(violation -> {
                    assertThat(violation.check()).isEqualTo(GuardCheck.NO_FUTURE_LEAKAGE);
                    assertThat(violation.affectedRows()).isEqualTo(1);
                });
    }

    @Test
    void predictionStampedAwayFromFeatureIsLeakage() {
        FeatureRecord feature = feature("CBA.AX", MORNING);
        Prediction prediction = TestFeatureFactory.prediction(feature, TradingAction.HOLD, Direction.FLAT);
        prediction.setCreatedTimestamp(MORNING.plus(Duration.ofHours(1)));
        predictionRepository.saveAndFlush(prediction);

        assertThat(guard.checkNoFutureLeakage())
                .extracting(GuardReport.Violation::detail)
                .singleElement()
                .asString()
                .contains("created_timestamp");
    }

    @Test
    void exitRecordedBeforeHorizonIsLookahead() {
        FeatureRecord feature = feature("CBA.AX", MORNING.minus(Duration.ofDays(2)));
        Outcome outcome = TestFeatureFactory.completeOutcome(feature, 100.0, 100.5, 101.0, 102.0);
        outcome.setExitRecordedAt1d(feature.getTimestamp().plus(Duration.ofHours(2)));
        outcomeRepository.saveAndFlush(outcome);

        assertThat(guard.checkOutcomeLookahead())
                .singleElement()
                .satisfies(violation -> {
                    assertThat(violation.check()).isEqualTo(GuardCheck.OUTCOME_LOOKAHEAD);
                    assertThat(violation.affectedRows()).isEqualTo(1);
                    assertThat(violation.detail()).contains("1d");
                });
    }

    @Test
    void storedReturnMustMatchPrices() {
        FeatureRecord feature = feature("CBA.AX", MORNING.minus(Duration.ofDays(2)));
        Outcome outcome = TestFeatureFactory.completeOutcome(feature, 100.0, 100.5, 101.0, 105.0);
        outcome.setReturnPct1d(0.05);
        outcomeRepository.saveAndFlush(outcome);

        assertThat(guard.checkReturnConsistency())
                .singleElement()
                .satisfies(violation -> {
                    assertThat(violation.affectedRows()).isEqualTo(1);
                    assertThat(violation.detail()).contains("1d=1").doesNotContain("1h=");
                });
    }

    @Test
    void earlyExitsAreCountedPerHorizon() {
        FeatureRecord first = feature("CBA.AX", MORNING.minus(Duration.ofDays(2)));
        Outcome early = TestFeatureFactory.completeOutcome(first, 100.0, 100.5, 101.0, 102.0);
        early.setExitRecordedAt1h(first.getTimestamp().plus(Duration.ofMinutes(59)));
        early.setExitRecordedAt4h(first.getTimestamp().plus(Duration.ofHours(3)));
        outcomeRepository.saveAndFlush(early);
        FeatureRecord second = feature("BHP.AX", MORNING.minus(Duration.ofDays(2)));
        Outcome onTime = TestFeatureFactory.completeOutcome(second, 50.0, 50.5, 51.0, 52.0);
        onTime.setExitRecordedAt1h(second.getTimestamp().plus(Duration.ofHours(1)));
        outcomeRepository.saveAndFlush(onTime);

        assertThat(guard.checkOutcomeLookahead())
                .singleElement()
                .satisfies(violation -> {
                    assertThat(violation.affectedRows()).isEqualTo(2);
                    assertThat(violation.detail()).contains("1h=1", "4h=1").doesNotContain("1d=");
                });
    }

    @Test
    void filledHorizonWithoutEntryPriceIsInconsistent() {
        FeatureRecord feature = feature("CBA.AX", MORNING.minus(Duration.ofDays(2)));
        Outcome outcome = TestFeatureFactory.completeOutcome(feature, 100.0, 100.5, 101.0, 102.0);
        outcome.setEntryPrice(null);
        outcomeRepository.saveAndFlush(outcome);

        assertThat(guard.checkReturnConsistency())
                .singleElement()
                .satisfies(violation -> assertThat(violation.affectedRows()).isEqualTo(3));
    }

    @Test
    void eveningNeedsAPhaseStateRow() {
        assertThat(guard.checkPhaseOrder(CYCLE))
                .extracting(GuardReport.Violation::check)
                .containsExactly(GuardCheck.PHASE_ORDER);

        phaseStateRepository.saveAndFlush(PipelinePhaseState.builder()
                .cycleDate(CYCLE)
                .lastCompletedPhase(PipelinePhase.MORNING)
                .phaseTimestamp(MORNING)
                .build());

        assertThat(guard.checkPhaseOrder(CYCLE)).isEmpty();
    }

    @Test
    void enforceThrowsWithTheReport() {
        assertThatThrownBy(() -> guard.enforce(PipelinePhase.EVENING, EVENING))
                .isInstanceOfSatisfying(TemporalIntegrityViolationException.class, ex -> {
                    assertThat(ex.getReport().phase()).isEqualTo(PipelinePhase.EVENING);
                    assertThat(ex.getReport().checksRun()).contains(GuardCheck.PHASE_ORDER.checkName());
                    assertThat(ex.getMessage()).contains("phase_order");
                });
    }

    private FeatureRecord feature(String symbol, Instant timestamp) {
        return featureRecordRepository.saveAndFlush(TestFeatureFactory.feature(symbol, timestamp));
    }
}
