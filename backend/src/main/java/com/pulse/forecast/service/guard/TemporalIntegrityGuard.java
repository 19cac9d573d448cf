package com.pulse.forecast.service.guard;

import com.pulse.forecast.config.ForecastProperties;
import com.pulse.forecast.exception.TemporalIntegrityViolationException;
import com.pulse.forecast.model.Horizon;
import com.pulse.forecast.model.PipelinePhase;
import com.pulse.forecast.model.PipelinePhaseState;
import com.pulse.forecast.repository.FeatureRecordRepository;
import com.pulse.forecast.repository.OutcomeRepository;
import com.pulse.forecast.repository.PipelinePhaseStateRepository;
import com.pulse.forecast.repository.PredictionRepository;
import com.pulse.forecast.service.feature.MarketCalendar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Read-only checks over the store that gate each phase. Every check is callable on its own and
 * returns the violations it found; {@link #inspect} runs the set that belongs to a phase.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemporalIntegrityGuard {

    static final Map<String, List<String>> REQUIRED_COLUMNS = requiredColumns();

    private final DataSource dataSource;
    private final FeatureRecordRepository featureRecordRepository;
    private final PredictionRepository predictionRepository;
    private final OutcomeRepository outcomeRepository;
    private final PipelinePhaseStateRepository phaseStateRepository;
    private final MarketCalendar marketCalendar;
    private final ForecastProperties forecastProperties;

    @Transactional(readOnly = true)
    public GuardReport inspect(PipelinePhase phase, Instant asOf) {
        List<GuardCheck> checks = new ArrayList<>(List.of(
                GuardCheck.SCHEMA_PRESENCE,
                GuardCheck.REFERENTIAL_INTEGRITY,
                GuardCheck.DUPLICATE_PREDICTIONS,
                GuardCheck.FEATURE_OUTCOME_COUNT,
                GuardCheck.NO_FUTURE_LEAKAGE,
                GuardCheck.OUTCOME_LOOKAHEAD,
                GuardCheck.RETURN_CONSISTENCY));
        if (phase == PipelinePhase.EVENING) {
            checks.add(GuardCheck.PHASE_ORDER);
        }
        List<GuardReport.Violation> violations = new ArrayList<>(checkSchemaPresence());
        // data checks cannot run against a broken schema
        if (violations.isEmpty()) {
            for (GuardCheck check : checks.subList(1, checks.size())) {
                violations.addAll(run(check, phase, asOf));
            }
        }
        GuardReport report = new GuardReport(phase, asOf, checks.stream().map(GuardCheck::checkName).toList(), violations);
        if (report.passed()) {
            log.info("Integrity guard passed phase={} checks={}", phase, checks.size());
        } else {
            log.warn("Integrity guard failed phase={} violations={}", phase, report.describe());
        }
        return report;
    }

    public GuardReport enforce(PipelinePhase phase, Instant asOf) {
        GuardReport report = inspect(phase, asOf);
        if (!report.passed()) {
            throw new TemporalIntegrityViolationException(report);
        }
        return report;
    }

    private List<GuardReport.Violation> run(GuardCheck check, PipelinePhase phase, Instant asOf) {
        return switch (check) {
            case DUPLICATE_PREDICTIONS -> checkDuplicatePredictions();
            case FEATURE_OUTCOME_COUNT -> checkFeatureOutcomeCount(phase, asOf);
            case NO_FUTURE_LEAKAGE -> checkNoFutureLeakage();
            case SCHEMA_PRESENCE -> checkSchemaPresence();
            case REFERENTIAL_INTEGRITY -> checkReferentialIntegrity();
            case OUTCOME_LOOKAHEAD -> checkOutcomeLookahead();
            case RETURN_CONSISTENCY -> checkReturnConsistency();
            case PHASE_ORDER -> checkPhaseOrder(marketCalendar.cycleDate(asOf));
        };
    }

    public List<GuardReport.Violation> checkDuplicatePredictions() {
        List<Object[]> duplicates = predictionRepository.findDuplicateSymbolDays();
        if (duplicates.isEmpty()) {
            return List.of();
        }
        long rows = duplicates.stream().mapToLong(row -> ((Number) row[2]).longValue()).sum();
        Object[] first = duplicates.get(0);
        return List.of(new GuardReport.Violation(GuardCheck.DUPLICATE_PREDICTIONS, rows,
                duplicates.size() + " symbol-days with several predictions, e.g. " + first[0] + " on " + first[1]));
    }

    /**
     * Every matured feature must own exactly one outcome. In the morning only features of earlier
     * cycles count, since today's have not been through an evening yet.
     */
    public List<GuardReport.Violation> checkFeatureOutcomeCount(PipelinePhase phase, Instant asOf) {
        Instant cutoff = asOf.minus(Horizon.shortest().duration());
        if (phase == PipelinePhase.MORNING) {
            Instant cycleStart = marketCalendar.cycleDate(asOf).atStartOfDay(forecastProperties.zone()).toInstant();
            if (cycleStart.isBefore(cutoff)) {
                cutoff = cycleStart;
            }
        }
        List<GuardReport.Violation> violations = new ArrayList<>();
        long missing = featureRecordRepository.countMatureWithoutOutcome(cutoff);
        if (missing > 0) {
            violations.add(new GuardReport.Violation(GuardCheck.FEATURE_OUTCOME_COUNT, missing,
                    "matured features without an outcome (cutoff " + cutoff + ")"));
        }
        long orphans = outcomeRepository.countOrphans();
        if (orphans > 0) {
            violations.add(new GuardReport.Violation(GuardCheck.FEATURE_OUTCOME_COUNT, orphans,
                    "outcomes without a feature"));
        }
        List<Long> several = outcomeRepository.findFeaturesWithSeveralOutcomes();
        if (!several.isEmpty()) {
            violations.add(new GuardReport.Violation(GuardCheck.FEATURE_OUTCOME_COUNT, several.size(),
                    "features with more than one outcome: " + several));
        }
        return violations;
    }

    public List<GuardReport.Violation> checkNoFutureLeakage() {
        List<GuardReport.Violation> violations = new ArrayList<>();
        long futureSignals = featureRecordRepository.countWithFutureSignals();
        if (futureSignals > 0) {
            violations.add(new GuardReport.Violation(GuardCheck.NO_FUTURE_LEAKAGE, futureSignals,
                    "features citing signals observed after the feature timestamp"));
        }
        long shifted = predictionRepository.countCreatedAwayFromFeature();
        if (shifted > 0) {
            violations.add(new GuardReport.Violation(GuardCheck.NO_FUTURE_LEAKAGE, shifted,
                    "predictions whose created_timestamp differs from the feature timestamp"));
        }
        return violations;
    }

    public List<GuardReport.Violation> checkSchemaPresence() {
        List<GuardReport.Violation> violations = new ArrayList<>();
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            for (Map.Entry<String, List<String>> entry : REQUIRED_COLUMNS.entrySet()) {
                Set<String> columns = columnsOf(metaData, entry.getKey());
                if (columns.isEmpty()) {
                    violations.add(new GuardReport.Violation(GuardCheck.SCHEMA_PRESENCE, 1,
                            "missing table " + entry.getKey()));
                    continue;
                }
                for (String column : entry.getValue()) {
                    if (!columns.contains(column)) {
                        violations.add(new GuardReport.Violation(GuardCheck.SCHEMA_PRESENCE, 1,
                                "missing column " + entry.getKey() + "." + column));
                    }
                }
            }
        } catch (SQLException ex) {
            violations.add(new GuardReport.Violation(GuardCheck.SCHEMA_PRESENCE, 0,
                    "schema metadata unavailable: " + ex.getMessage()));
        }
        return violations;
    }

    public List<GuardReport.Violation> checkReferentialIntegrity() {
        List<GuardReport.Violation> violations = new ArrayList<>();
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            requireUniqueIndex(metaData, "enhanced_outcomes", Set.of("feature_id")).ifPresent(violations::add);
            requireUniqueIndex(metaData, "predictions", Set.of("symbol", "prediction_date")).ifPresent(violations::add);
        } catch (SQLException ex) {
            violations.add(new GuardReport.Violation(GuardCheck.REFERENTIAL_INTEGRITY, 0,
                    "index metadata unavailable: " + ex.getMessage()));
        }
        return violations;
    }

    public List<GuardReport.Violation> checkOutcomeLookahead() {
        Map<Horizon, Long> early = new EnumMap<>(Horizon.class);
        early.put(Horizon.H1, outcomeRepository.countEarlyExits1h());
        early.put(Horizon.H4, outcomeRepository.countEarlyExits4h());
        early.put(Horizon.D1, outcomeRepository.countEarlyExits1d());
        return summarize(GuardCheck.OUTCOME_LOOKAHEAD, early, "exit prices recorded before the horizon elapsed");
    }

    public List<GuardReport.Violation> checkReturnConsistency() {
        double tolerance = forecastProperties.getGuard().getReturnTolerance();
        Map<Horizon, Long> inconsistent = new EnumMap<>(Horizon.class);
        inconsistent.put(Horizon.H1, outcomeRepository.countInconsistentReturns1h(tolerance));
        inconsistent.put(Horizon.H4, outcomeRepository.countInconsistentReturns4h(tolerance));
        inconsistent.put(Horizon.D1, outcomeRepository.countInconsistentReturns1d(tolerance));
        return summarize(GuardCheck.RETURN_CONSISTENCY, inconsistent,
                "stored returns disagree with ((exit-entry)/entry)*100");
    }

    private static List<GuardReport.Violation> summarize(GuardCheck check, Map<Horizon, Long> perHorizon,
                                                         String description) {
        long affected = 0;
        StringJoiner breakdown = new StringJoiner(", ", " (", ")");
        for (Map.Entry<Horizon, Long> entry : perHorizon.entrySet()) {
            if (entry.getValue() > 0) {
                affected += entry.getValue();
                breakdown.add(entry.getKey().label() + "=" + entry.getValue());
            }
        }
        if (affected == 0) {
            return List.of();
        }
        return List.of(new GuardReport.Violation(check, affected, description + breakdown));
    }

    /**
     * The evening needs a completed morning for the same cycle. A completed evening is also accepted
     * so that the evening phase can be rerun.
     */
    public List<GuardReport.Violation> checkPhaseOrder(LocalDate cycleDate) {
        Optional<PipelinePhaseState> state = phaseStateRepository.findByCycleDate(cycleDate);
        if (state.isPresent()) {
            return List.of();
        }
        return List.of(new GuardReport.Violation(GuardCheck.PHASE_ORDER, 0,
                "morning phase has not completed for cycle " + cycleDate));
    }

    private Set<String> columnsOf(DatabaseMetaData metaData, String table) throws SQLException {
        Set<String> columns = readColumns(metaData, table);
        if (columns.isEmpty()) {
            columns = readColumns(metaData, table.toUpperCase(Locale.ROOT));
        }
        return columns;
    }

    private Set<String> readColumns(DatabaseMetaData metaData, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (ResultSet rs = metaData.getColumns(null, null, table, null)) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }

    private Optional<GuardReport.Violation> requireUniqueIndex(DatabaseMetaData metaData, String table,
                                                               Set<String> expectedColumns) throws SQLException {
        Map<String, Set<String>> indexes = readUniqueIndexes(metaData, table);
        if (indexes.isEmpty()) {
            indexes = readUniqueIndexes(metaData, table.toUpperCase(Locale.ROOT));
        }
        if (indexes.containsValue(expectedColumns)) {
            return Optional.empty();
        }
        return Optional.of(new GuardReport.Violation(GuardCheck.REFERENTIAL_INTEGRITY, 0,
                "no unique index on " + table + expectedColumns));
    }

    private Map<String, Set<String>> readUniqueIndexes(DatabaseMetaData metaData, String table) throws SQLException {
        Map<String, Set<String>> indexes = new HashMap<>();
        try (ResultSet rs = metaData.getIndexInfo(null, null, table, true, false)) {
            while (rs.next()) {
                String indexName = rs.getString("INDEX_NAME");
                String column = rs.getString("COLUMN_NAME");
                if (indexName == null || column == null) {
                    continue;
                }
                indexes.computeIfAbsent(indexName, key -> new HashSet<>()).add(column.toLowerCase(Locale.ROOT));
            }
        }
        return indexes;
    }

    private static Map<String, List<String>> requiredColumns() {
        Map<String, List<String>> required = new LinkedHashMap<>();
        required.put("enhanced_features", List.of("id", "symbol", "feature_timestamp", "cycle_date"));
        required.put("predictions", List.of("feature_id", "prediction_date", "created_timestamp"));
        required.put("enhanced_outcomes", List.of("feature_id", "recorded_timestamp", "exit_recorded_at_1d"));
        required.put("model_performance", List.of("version_id", "training_cutoff", "status"));
        required.put("pipeline_phase_state", List.of("cycle_date", "last_completed_phase", "phase_timestamp"));
        return required;
    }
}
