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
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Realized prices and returns for exactly one feature row. Horizon fields start null and are
 * backfilled once each; a filled field is never rewritten.
 */
@Entity
@Table(name = "enhanced_outcomes",
        uniqueConstraints = @UniqueConstraint(columnNames = {"feature_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Outcome {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "feature_id", nullable = false)
    private Long featureId;

    @Column(nullable = false, length = 32)
    private String symbol;

    private Double entryPrice;

    @Column(name = "exit_price_1h")
    private Double exitPrice1h;
    @Column(name = "exit_price_4h")
    private Double exitPrice4h;
    @Column(name = "exit_price_1d")
    private Double exitPrice1d;

    @Column(name = "return_pct_1h")
    private Double returnPct1h;
    @Column(name = "return_pct_4h")
    private Double returnPct4h;
    @Column(name = "return_pct_1d")
    private Double returnPct1d;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction_1h")
    private Direction direction1h;
    @Enumerated(EnumType.STRING)
    @Column(name = "direction_4h")
    private Direction direction4h;
    @Enumerated(EnumType.STRING)
    @Column(name = "direction_1d")
    private Direction direction1d;

    @Column(name = "exit_recorded_at_1h")
    private Instant exitRecordedAt1h;
    @Column(name = "exit_recorded_at_4h")
    private Instant exitRecordedAt4h;
    @Column(name = "exit_recorded_at_1d")
    private Instant exitRecordedAt1d;

    @Enumerated(EnumType.STRING)
    private Direction realizedDirection;

    private Double realizedReturnPct;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Status status;

    @Column(nullable = false)
    private Instant recordedTimestamp;

    @Version
    private Long version;

    public enum Status {
        PENDING,
        COMPLETE
    }

    public Double exitPrice(Horizon horizon) {
        return switch (horizon) {
            case H1 -> exitPrice1h;
            case H4 -> exitPrice4h;
            case D1 -> exitPrice1d;
        };
    }

    public Double returnPct(Horizon horizon) {
        return switch (horizon) {
            case H1 -> returnPct1h;
            case H4 -> returnPct4h;
            case D1 -> returnPct1d;
        };
    }

    public Direction direction(Horizon horizon) {
        return switch (horizon) {
            case H1 -> direction1h;
            case H4 -> direction4h;
            case D1 -> direction1d;
        };
    }

    public Instant exitRecordedAt(Horizon horizon) {
        return switch (horizon) {
            case H1 -> exitRecordedAt1h;
            case H4 -> exitRecordedAt4h;
            case D1 -> exitRecordedAt1d;
        };
    }

    public boolean isFilled(Horizon horizon) {
        return exitPrice(horizon) != null;
    }

    /**
     * Writes the realized values for one horizon. Callers must check {@link #isFilled} first.
     */
    public void fill(Horizon horizon, double exitPrice, double returnPct, Direction direction, Instant recordedAt) {
        switch (horizon) {
            case H1 -> {
                exitPrice1h = exitPrice;
                returnPct1h = returnPct;
                direction1h = direction;
                exitRecordedAt1h = recordedAt;
            }
            case H4 -> {
                exitPrice4h = exitPrice;
                returnPct4h = returnPct;
                direction4h = direction;
                exitRecordedAt4h = recordedAt;
            }
            case D1 -> {
                exitPrice1d = exitPrice;
                returnPct1d = returnPct;
                direction1d = direction;
                exitRecordedAt1d = recordedAt;
            }
        }
        if (horizon == Horizon.longest()) {
            realizedReturnPct = returnPct;
            realizedDirection = direction;
        }
    }

    public boolean isComplete() {
        for (Horizon horizon : Horizon.values()) {
            if (!isFilled(horizon)) {
                return false;
            }
        }
        return true;
    }
}
