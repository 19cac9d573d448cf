package com.pulse.forecast.dto;

import com.pulse.forecast.model.ModelVersion;

import java.time.Instant;

public record ModelVersionView(
        String versionId,
        ModelVersion.Status status,
        Instant trainedAt,
        Instant trainingCutoff,
        String featureSchemaHash,
        Double accuracy1h,
        Double accuracy4h,
        Double accuracy1d,
        Double mae1h,
        Double mae4h,
        Double mae1d,
        int trainingSampleCount,
        int validationSampleCount,
        String rejectionReason
) {

    public static ModelVersionView from(ModelVersion version) {
        return new ModelVersionView(version.getVersionId(), version.getStatus(), version.getTrainedAt(),
                version.getTrainingCutoff(), version.getFeatureSchemaHash(), version.getAccuracy1h(),
                version.getAccuracy4h(), version.getAccuracy1d(), version.getMae1h(), version.getMae4h(),
                version.getMae1d(), version.getTrainingSampleCount(), version.getValidationSampleCount(),
                version.getRejectionReason());
    }
}
