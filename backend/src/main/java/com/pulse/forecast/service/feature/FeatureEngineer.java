package com.pulse.forecast.service.feature;

import com.pulse.forecast.exception.IncompleteSignalException;
import com.pulse.forecast.exception.TemporalIntegrityViolationException;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.PipelinePhase;
import com.pulse.forecast.repository.FeatureRecordRepository;
import com.pulse.forecast.service.guard.GuardCheck;
import com.pulse.forecast.service.guard.GuardReport;
import com.pulse.forecast.signal.MarketContextSignal;
import com.pulse.forecast.signal.SentimentSignal;
import com.pulse.forecast.signal.SignalBundle;
import com.pulse.forecast.signal.SourceSignal;
import com.pulse.forecast.signal.SourceType;
import com.pulse.forecast.signal.TechnicalSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns a {@link SignalBundle} into one persisted {@link FeatureRecord}. Missing or out-of-range
 * optional inputs take neutral defaults and are listed in {@code defaulted_fields}; a missing
 * symbol, timestamp or technical signal discards the record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureEngineer {

    private static final double DEFAULT_VIX = 20.0;

    private final FeatureRecordRepository featureRecordRepository;
    private final MarketCalendar marketCalendar;

    /**
     * Returns the record already stored for the symbol's cycle, or fetches signals and stores a new
     * one. Signals are only fetched when no record exists, so a resumed run does no remote calls for
     * symbols it already engineered.
     */
    public BuildResult findOrBuild(String symbol, LocalDate cycleDate, Supplier<SignalBundle> signals) {
        Optional<FeatureRecord> existing = featureRecordRepository.findBySymbolAndCycleDate(symbol, cycleDate);
        if (existing.isPresent()) {
            log.debug("Reusing feature row id={} symbol={}", existing.get().getId(), symbol);
            return new BuildResult(existing.get(), false);
        }
        return new BuildResult(build(symbol, signals.get()), true);
    }

    public FeatureRecord build(String symbol, SignalBundle bundle) {
        FeatureRecord record = engineer(symbol, bundle);
        try {
            FeatureRecord saved = featureRecordRepository.save(record);
            log.info("Feature row stored id={} symbol={} quality={} defaulted={}",
                    saved.getId(), symbol, saved.getQualityScore(), saved.getDefaultedFieldCount());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            // a concurrent run stored the same symbol-cycle first
            return featureRecordRepository.findBySymbolAndCycleDate(symbol, record.getCycleDate())
                    .orElseThrow(() -> ex);
        }
    }

    FeatureRecord engineer(String symbol, SignalBundle bundle) {
        if (symbol == null || symbol.isBlank()) {
            throw new IncompleteSignalException(symbol, "Symbol is required");
        }
        if (bundle == null || bundle.timestamp() == null) {
            throw new IncompleteSignalException(symbol, "Signal timestamp is required for " + symbol);
        }
        if (!symbol.equals(bundle.symbol())) {
            throw new IncompleteSignalException(symbol, "Signal bundle belongs to " + bundle.symbol());
        }
        Instant timestamp = bundle.timestamp();
        rejectFutureSignals(symbol, timestamp, bundle);

        FieldResolver fields = new FieldResolver(symbol);
        SentimentSignal sentiment = bundle.sentiment();
        TechnicalSignal technical = bundle.technical();
        MarketContextSignal context = bundle.context();

        double sentimentScore = fields.resolve("sentiment_score", sentiment == null ? null : sentiment.score(), -1, 1, 0);
        double sentimentConfidence = fields.resolve("sentiment_confidence", sentiment == null ? null : sentiment.confidence(), 0, 1, 0);
        double articleCount = fields.resolve("article_count",
                sentiment == null || sentiment.articleCount() == null ? null : sentiment.articleCount().doubleValue(),
                0, Integer.MAX_VALUE, 0);
        double socialScore = fields.resolve("social_score", sentiment == null ? null : sentiment.socialScore(), -1, 1, 0);

        int observedBeforeTechnical = fields.observed;
        double rsi = fields.resolve("rsi", technical == null ? null : technical.rsi(), 0, 100, 50);
        double macdLine = fields.resolve("macd_line", technical == null ? null : technical.macdLine(), -Double.MAX_VALUE, Double.MAX_VALUE, 0);
        double macdSignal = fields.resolve("macd_signal", technical == null ? null : technical.macdSignal(), -Double.MAX_VALUE, Double.MAX_VALUE, 0);
        double macdHistogram = fields.resolve("macd_histogram", technical == null ? null : technical.macdHistogram(), -Double.MAX_VALUE, Double.MAX_VALUE, 0);
        double sma20 = fields.resolve("sma20_ratio", technical == null ? null : technical.sma20Ratio(), 0, 10, 1);
        double sma50 = fields.resolve("sma50_ratio", technical == null ? null : technical.sma50Ratio(), 0, 10, 1);
        double sma200 = fields.resolve("sma200_ratio", technical == null ? null : technical.sma200Ratio(), 0, 10, 1);
        double bollingerWidth = fields.resolve("bollinger_width", technical == null ? null : technical.bollingerWidth(), 0, 10, 0);
        double atr = fields.resolve("atr", technical == null ? null : technical.atr(), 0, Double.MAX_VALUE, 0);
        double atrPct = fields.resolve("atr_pct", technical == null ? null : technical.atrPct(), 0, 100, 0);
        double volatility = fields.resolve("volatility", technical == null ? null : technical.volatility(), 0, 500, 0);
        double volumeRatio = fields.resolve("volume_ratio", technical == null ? null : technical.volumeRatio(), 0, 50, 1);
        Double currentPrice = fields.resolvePrice("current_price", technical == null ? null : technical.currentPrice());
        double priceChange1d = fields.resolve("price_change_1d", technical == null ? null : technical.priceChange1d(), -50, 50, 0);
        double priceChange5d = fields.resolve("price_change_5d", technical == null ? null : technical.priceChange5d(), -100, 100, 0);
        double dailyRange = fields.resolve("daily_range", technical == null ? null : technical.dailyRange(), 0, 100, 0);
        if (fields.observed == observedBeforeTechnical) {
            throw new IncompleteSignalException(symbol, "No valid technical field for " + symbol);
        }

        MarketCalendar.CalendarTerms calendar = marketCalendar.termsAt(timestamp);
        double indexChange = fields.resolve("index_change_pct", context == null ? null : context.indexChangePct(), -50, 50, 0);
        double vix = fields.resolve("vix", context == null ? null : context.vix(), 0, 200, DEFAULT_VIX);
        boolean marketHours = fields.resolveFlag("market_hours_flag", context == null ? null : context.marketHours(),
                calendar.marketHours());
        double sectorPerformance = fields.resolve("sector_performance", context == null ? null : context.sectorPerformance(), -100, 100, 0);
        double marketBreadth = fields.resolve("market_breadth", context == null ? null : context.marketBreadth(), -1, 1, 0);

        double momentum = priceChange1d + (rsi - 50);
        double technicalDirection = Math.signum(rsi - 50);

        return FeatureRecord.builder()
                .symbol(symbol)
                .timestamp(timestamp)
                .cycleDate(marketCalendar.cycleDate(timestamp))
                .sentimentScore(sentimentScore)
                .sentimentConfidence(sentimentConfidence)
                .articleCount((int) articleCount)
                .socialScore(socialScore)
                .rsi(rsi)
                .macdLine(macdLine)
                .macdSignal(macdSignal)
                .macdHistogram(macdHistogram)
                .sma20Ratio(sma20)
                .sma50Ratio(sma50)
                .sma200Ratio(sma200)
                .bollingerWidth(bollingerWidth)
                .atr(atr)
                .atrPct(atrPct)
                .volatility(volatility)
                .volumeRatio(volumeRatio)
                .currentPrice(currentPrice)
                .priceChange1d(priceChange1d)
                .priceChange5d(priceChange5d)
                .dailyRange(dailyRange)
                .indexChangePct(indexChange)
                .vix(vix)
                .marketHours(marketHours)
                .sectorPerformance(sectorPerformance)
                .marketBreadth(marketBreadth)
                .sentimentMomentum(sentimentScore * momentum)
                .sentimentRsi(sentimentScore * (rsi - 50) / 50)
                .volumeSentiment(volumeRatio * sentimentScore)
                .confidenceVolatility(sentimentConfidence / (volatility + 0.01))
                .newsVolumeImpact(articleCount * volumeRatio)
                .technicalSentimentDivergence(Math.abs(technicalDirection - sentimentScore))
                .openingHour(calendar.openingHour())
                .closingHour(calendar.closingHour())
                .monday(calendar.monday())
                .friday(calendar.friday())
                .dayOfWeek(calendar.dayOfWeek())
                .monthEnd(calendar.monthEnd())
                .quarterEnd(calendar.quarterEnd())
                .sentimentObservedAt(sentiment == null ? null : sentiment.observedAt())
                .technicalObservedAt(technical.observedAt())
                .contextObservedAt(context == null ? null : context.observedAt())
                .degradedSources(bundle.degradedSources().isEmpty() ? null : bundle.degradedSources().stream()
                        .map(SourceType::name).sorted().collect(Collectors.joining(",")))
                .defaultedFields(fields.defaulted.isEmpty() ? null : String.join(",", fields.defaulted))
                .defaultedFieldCount(fields.defaulted.size())
                .qualityScore(fields.quality())
                .featureVersion(FeatureVectorSchema.FEATURE_VERSION)
                .createdAt(Instant.now())
                .build();
    }

    private void rejectFutureSignals(String symbol, Instant timestamp, SignalBundle bundle) {
        List<GuardReport.Violation> violations = Stream.of(bundle.sentiment(), bundle.technical(), bundle.context())
                .filter(Objects::nonNull)
                .filter(signal -> signal.observedAt() != null && signal.observedAt().isAfter(timestamp))
                .map(signal -> new GuardReport.Violation(GuardCheck.NO_FUTURE_LEAKAGE, 1,
                        describeLeak(symbol, timestamp, signal)))
                .toList();
        if (!violations.isEmpty()) {
            throw new TemporalIntegrityViolationException(GuardReport.of(PipelinePhase.MORNING, Instant.now(), violations));
        }
    }

    private String describeLeak(String symbol, Instant timestamp, SourceSignal signal) {
        return signal.sourceType() + " signal for " + symbol + " observed at " + signal.observedAt()
                + " after feature timestamp " + timestamp;
    }

    /**
     * Tracks which optional inputs were observed and which fell back to a default.
     */
    private static final class FieldResolver {

        private final String symbol;
        private final List<String> defaulted = new ArrayList<>();
        private int observed;
        private int total;

        private FieldResolver(String symbol) {
            this.symbol = symbol;
        }

        double resolve(String name, Double value, double min, double max, double fallback) {
            total++;
            if (value == null) {
                defaulted.add(name);
                return fallback;
            }
            if (!Double.isFinite(value) || value < min || value > max) {
                log.warn("Invalid signal value replaced by default symbol={} field={} value={}", symbol, name, value);
                defaulted.add(name);
                return fallback;
            }
            observed++;
            return value;
        }

        Double resolvePrice(String name, Double value) {
            total++;
            if (value == null || !Double.isFinite(value) || value <= 0) {
                if (value != null) {
                    log.warn("Invalid price dropped symbol={} field={} value={}", symbol, name, value);
                }
                defaulted.add(name);
                return null;
            }
            observed++;
            return value;
        }

        boolean resolveFlag(String name, Boolean value, boolean fallback) {
            total++;
            if (value == null) {
                defaulted.add(name);
                return fallback;
            }
            observed++;
            return value;
        }

        double quality() {
            return total == 0 ? 0.0 : (double) observed / total;
        }
    }

    public record BuildResult(FeatureRecord record, boolean created) {}
}
