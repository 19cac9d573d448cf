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
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(name = "model_performance",
        uniqueConstraints = @UniqueConstraint(columnNames = {"version_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "version_id", nullable = false, length = 64)
    private String versionId;

    @Column(nullable = false)
    private Instant trainedAt;

    /**
     * Timestamp of the last feature row used for fitting. Evaluation only uses later rows.
     */
    @Column(nullable = false)
    private Instant trainingCutoff;

    @Column(nullable = false, length = 64)
    private String featureSchemaHash;

    @Column(name = "accuracy_1h")
    private Double accuracy1h;
    @Column(name = "accuracy_4h")
    private Double accuracy4h;
    @Column(name = "accuracy_1d")
    private Double accuracy1d;

    @Column(name = "mae_1h")
    private Double mae1h;
    @Column(name = "mae_4h")
    private Double mae4h;
    @Column(name = "mae_1d")
    private Double mae1d;

    private int trainingSampleCount;

    private int validationSampleCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Status status;

    @Column(length = 1000)
    private String rejectionReason;

    @Column(columnDefinition = "TEXT")
    private String metricsJson;

    @ToString.Exclude
    @Column(nullable = false, columnDefinition = "TEXT")
    private String modelPayload;

    @Column(nullable = false)
    private Instant createdAt;

    public enum Status {
        CANDIDATE,
        ACTIVE,
        SUPERSEDED,
        REJECTED
    }

    public void recordAccuracy(Horizon horizon, double accuracy, double mae) {
        switch (horizon) {
            case H1 -> {
                accuracy1h = accuracy;
                mae1h = mae;
            }
            case H4 -> {
                accuracy4h = accuracy;
                mae4h = mae;
            }
            case D1 -> {
                accuracy1d = accuracy;
                mae1d = mae;
            }
        }
    }
}
