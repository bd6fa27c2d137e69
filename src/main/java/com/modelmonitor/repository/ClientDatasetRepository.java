package com.modelmonitor.repository;

import com.modelmonitor.entity.ClientDataset;
import com.modelmonitor.entity.DatasetStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ClientDatasetRepository extends JpaRepository<ClientDataset, UUID> {

    List<ClientDataset> findByModelKeyAndStatusOrderByDatasetVersionAsc(String modelKey, DatasetStatus status);

    List<ClientDataset> findByRetrainingJobId(UUID retrainingJobId);

    Optional<ClientDataset> findTopByModelKeyOrderByDatasetVersionDesc(String modelKey);

    @Query("""
        SELECT COALESCE(SUM(d.itemCount), 0) FROM ClientDataset d
        WHERE d.modelKey = :modelKey
          AND d.status   = :status
    """)
    long sumItemCount(@Param("modelKey") String modelKey, @Param("status") DatasetStatus status);
}
