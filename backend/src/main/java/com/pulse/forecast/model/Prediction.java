package com.pulse.forecast.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

@Entity
@Table(name = "predictions",
        uniqueConstraints = @UniqueConstraint(columnNames = {"symbol", "prediction_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Prediction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "feature_id", nullable = false)
    private Long featureId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(name = "prediction_date", nullable = false)
    private LocalDate predictionDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction_1h", nullable = false)
    private Direction direction1h;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction_4h", nullable = false)
    private Direction direction4h;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction_1d", nullable = false)
    private Direction direction1d;

    @Column(name = "magnitude_1h")
    private double magnitude1h;

    @Column(name = "magnitude_4h")
    private double magnitude4h;

    @Column(name = "magnitude_1d")
    private double magnitude1d;

    @Column(name = "confidence_1h")
    private double confidence1h;

    @Column(name = "confidence_4h")
    private double confidence4h;

    @Column(name = "confidence_1d")
    private double confidence1d;

    private double confidenceAvg;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TradingAction optimalAction;

    @Column(nullable = false, length = 64)
    private String modelVersionId;

    /**
     * Always equal to the source feature's timestamp.
     */
    @Column(nullable = false)
    private Instant createdTimestamp;

    @Column(nullable = false)
    private Instant persistedAt;

    public Direction direction(Horizon horizon) {
        return switch (horizon) {
            case H1 -> direction1h;
            case H4 -> direction4h;
            case D1 -> direction1d;
        };
    }

    public double magnitude(Horizon horizon) {
        return switch (horizon) {
            case H1 -> magnitude1h;
            case H4 -> magnitude4h;
            case D1 -> magnitude1d;
        };
    }

    public double confidence(Horizon horizon) {
        return switch (horizon) {
            case H1 -> confidence1h;
            case H4 -> confidence4h;
            case D1 -> confidence1d;
        };
    }
}
