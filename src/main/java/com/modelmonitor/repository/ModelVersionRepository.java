package com.modelmonitor.repository;

import com.modelmonitor.entity.ModelVersion;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ModelVersionRepository extends JpaRepository<ModelVersion, UUID> {

    Optional<ModelVersion> findByModelKeyAndVersion(String modelKey, String version);

    boolean existsByModelKeyAndVersion(String modelKey, String version);

    List<ModelVersion> findByModelKeyOrderByCreatedAtDesc(String modelKey);
}
