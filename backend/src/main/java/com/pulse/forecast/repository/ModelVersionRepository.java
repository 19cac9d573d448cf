package com.pulse.forecast.repository;

import com.pulse.forecast.model.ModelVersion;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ModelVersionRepository extends JpaRepository<ModelVersion, Long> {

    Optional<ModelVersion> findByVersionId(String versionId);

    Optional<ModelVersion> findFirstByStatusOrderByTrainedAtDesc(ModelVersion.Status status);

    List<ModelVersion> findByStatus(ModelVersion.Status status);

    List<ModelVersion> findAllByOrderByTrainedAtDesc();
}
