package com.pulse.forecast.service.prediction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.forecast.exception.ForecastException;
import com.pulse.forecast.exception.NotFoundException;
import com.pulse.forecast.ml.TrainedEnsemble;
import com.pulse.forecast.model.ModelVersion;
import com.pulse.forecast.repository.ModelVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores model versions and tracks which one is active. Versions are append-only; only the status
 * column moves, and at most one row is ACTIVE.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistry {

    private static final DateTimeFormatter VERSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss")
            .withZone(ZoneOffset.UTC);

    private final ModelVersionRepository modelVersionRepository;
    private final ObjectMapper objectMapper;
    private final Map<String, TrainedEnsemble> loaded = new ConcurrentHashMap<>();

    public Optional<ActiveModel> active() {
        return modelVersionRepository.findFirstByStatusOrderByTrainedAtDesc(ModelVersion.Status.ACTIVE)
                .map(version -> new ActiveModel(version, load(version)));
    }

    public ModelVersion find(String versionId) {
        return modelVersionRepository.findByVersionId(versionId)
                .orElseThrow(() -> new NotFoundException("Model version not found: " + versionId));
    }

    public List<ModelVersion> list() {
        return modelVersionRepository.findAllByOrderByTrainedAtDesc();
    }

    public TrainedEnsemble load(ModelVersion version) {
        return loaded.computeIfAbsent(version.getVersionId(), id -> {
            try {
                return objectMapper.readValue(version.getModelPayload(), TrainedEnsemble.class);
            } catch (JsonProcessingException ex) {
                throw new ForecastException("Unreadable payload for model version " + id, ex);
            }
        });
    }

    public ModelVersion saveCandidate(TrainingResult result, Instant trainedAt) {
        String versionId = "fm-" + VERSION_FORMAT.format(trainedAt) + "-" + UUID.randomUUID().toString().substring(0, 8);
        ModelVersion version = ModelVersion.builder()
                .versionId(versionId)
                .trainedAt(trainedAt)
                .trainingCutoff(result.trainingCutoff())
                .featureSchemaHash(result.ensemble().schemaHash())
                .trainingSampleCount(result.trainingSamples())
                .validationSampleCount(result.holdoutSamples())
                .status(ModelVersion.Status.CANDIDATE)
                .modelPayload(serialize(result.ensemble()))
                .createdAt(Instant.now())
                .build();
        ModelVersion saved = modelVersionRepository.save(version);
        loaded.put(versionId, result.ensemble());
        log.info("Model candidate stored versionId={} trainingSamples={} holdout={} cutoff={}",
                versionId, result.trainingSamples(), result.holdoutSamples(), result.trainingCutoff());
        return saved;
    }

    public ModelVersion update(ModelVersion version) {
        return modelVersionRepository.save(version);
    }

    /**
     * Supersedes the current ACTIVE row and activates {@code candidate} in one transaction.
     */
    @Transactional
    public ModelVersion activate(ModelVersion candidate) {
        ModelVersion target = modelVersionRepository.findByVersionId(candidate.getVersionId())
                .orElseThrow(() -> new NotFoundException("Model version not found: " + candidate.getVersionId()));
        for (ModelVersion current : modelVersionRepository.findByStatus(ModelVersion.Status.ACTIVE)) {
            if (!current.getVersionId().equals(target.getVersionId())) {
                current.setStatus(ModelVersion.Status.SUPERSEDED);
                modelVersionRepository.save(current);
                log.info("Model superseded versionId={}", current.getVersionId());
            }
        }
        target.setStatus(ModelVersion.Status.ACTIVE);
        target.setRejectionReason(null);
        copyMetrics(candidate, target);
        ModelVersion saved = modelVersionRepository.save(target);
        log.info("Model activated versionId={}", saved.getVersionId());
        return saved;
    }

    @Transactional
    public ModelVersion reject(ModelVersion candidate, String reason) {
        ModelVersion target = modelVersionRepository.findByVersionId(candidate.getVersionId())
                .orElseThrow(() -> new NotFoundException("Model version not found: " + candidate.getVersionId()));
        target.setStatus(ModelVersion.Status.REJECTED);
        target.setRejectionReason(reason);
        copyMetrics(candidate, target);
        log.warn("Model rejected versionId={} reason={}", target.getVersionId(), reason);
        return modelVersionRepository.save(target);
    }

    private void copyMetrics(ModelVersion source, ModelVersion target) {
        if (source == target) {
            return;
        }
        target.setAccuracy1h(source.getAccuracy1h());
        target.setAccuracy4h(source.getAccuracy4h());
        target.setAccuracy1d(source.getAccuracy1d());
        target.setMae1h(source.getMae1h());
        target.setMae4h(source.getMae4h());
        target.setMae1d(source.getMae1d());
        target.setValidationSampleCount(source.getValidationSampleCount());
        target.setMetricsJson(source.getMetricsJson());
    }

    private String serialize(TrainedEnsemble ensemble) {
        try {
            return objectMapper.writeValueAsString(ensemble);
        } catch (JsonProcessingException ex) {
            throw new ForecastException("Model payload could not be serialised", ex);
        }
    }

    public record ActiveModel(ModelVersion version, TrainedEnsemble ensemble) {}
}
