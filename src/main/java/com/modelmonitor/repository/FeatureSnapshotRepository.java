package com.modelmonitor.repository;

import com.modelmonitor.entity.FeatureSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface FeatureSnapshotRepository extends JpaRepository<FeatureSnapshot, UUID> {

    Optional<FeatureSnapshot> findByModelKeyAndVersion(String modelKey, String version);
}
