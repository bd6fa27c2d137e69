package com.modelmonitor.repository;

import com.modelmonitor.entity.RetrainingJob;
import com.modelmonitor.entity.RetrainingStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RetrainingJobRepository extends JpaRepository<RetrainingJob, UUID> {

    boolean existsByModelKeyAndStatusIn(String modelKey, List<RetrainingStatus> statuses);

    long countByModelKeyAndStatus(String modelKey, RetrainingStatus status);

    List<RetrainingJob> findByStatusAndStartedAtBefore(RetrainingStatus status, Instant cutoff);

    List<RetrainingJob> findByStatusAndCreatedAtBefore(RetrainingStatus status, Instant cutoff);

    Optional<RetrainingJob> findFirstByModelKeyAndStatusAndNewModelVersionAndRevertedAtIsNullOrderByCompletedAtDesc(
        String modelKey, RetrainingStatus status, String newModelVersion
    );

    List<RetrainingJob> findByModelKeyOrderByCreatedAtDesc(String modelKey);
}
