package com.pulse.forecast.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One engineered feature row per symbol per cycle. Written once by the feature engineer and
 * never updated.
 */
@Entity
@Table(name = "enhanced_features",
        uniqueConstraints = @UniqueConstraint(columnNames = {"symbol", "cycle_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(name = "feature_timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "cycle_date", nullable = false)
    private LocalDate cycleDate;

    // sentiment
    private double sentimentScore;
    private double sentimentConfidence;
    private int articleCount;
    private double socialScore;

    // technical
    private double rsi;
    private double macdLine;
    private double macdSignal;
    private double macdHistogram;
    @Column(name = "sma20_ratio")
    private double sma20Ratio;
    @Column(name = "sma50_ratio")
    private double sma50Ratio;
    @Column(name = "sma200_ratio")
    private double sma200Ratio;
    private double bollingerWidth;
    private double atr;
    private double atrPct;
    private double volatility;
    private double volumeRatio;
    private Double currentPrice;
    @Column(name = "price_change_1d")
    private double priceChange1d;
    @Column(name = "price_change_5d")
    private double priceChange5d;
    private double dailyRange;

    // market context
    private double indexChangePct;
    private double vix;
    @Column(name = "market_hours_flag")
    private boolean marketHours;
    private double sectorPerformance;
    private double marketBreadth;

    // interaction terms
    private double sentimentMomentum;
    private double sentimentRsi;
    private double volumeSentiment;
    private double confidenceVolatility;
    private double newsVolumeImpact;
    private double technicalSentimentDivergence;

    // calendar terms
    @Column(name = "opening_hour_flag")
    private boolean openingHour;
    @Column(name = "closing_hour_flag")
    private boolean closingHour;
    @Column(name = "monday_flag")
    private boolean monday;
    @Column(name = "friday_flag")
    private boolean friday;
    private int dayOfWeek;
    @Column(name = "month_end_flag")
    private boolean monthEnd;
    @Column(name = "quarter_end_flag")
    private boolean quarterEnd;

    private Instant sentimentObservedAt;
    private Instant technicalObservedAt;
    private Instant contextObservedAt;

    private String degradedSources;

    @Column(length = 2000)
    private String defaultedFields;

    private int defaultedFieldCount;

    private double qualityScore;

    @Column(nullable = false, length = 32)
    private String featureVersion;

    @Column(nullable = false)
    private Instant createdAt;
}
