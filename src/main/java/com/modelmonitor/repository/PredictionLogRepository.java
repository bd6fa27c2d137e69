package com.modelmonitor.repository;

import com.modelmonitor.entity.PredictionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface PredictionLogRepository extends JpaRepository<PredictionLog, UUID> {

    @Query("""
        SELECT p FROM PredictionLog p
        WHERE p.modelKey     = :modelKey
          AND p.modelVersion = :version
          AND p.createdAt   >= :since
          AND p.createdAt   <= :until
        ORDER BY p.createdAt ASC
    """)
    List<PredictionLog> findInWindow(
        @Param("modelKey") String modelKey,
        @Param("version")  String version,
        @Param("since")    Instant since,
        @Param("until")    Instant until
    );

    @Transactional
    @Modifying
    @Query("""
        DELETE FROM PredictionLog p
        WHERE p.createdAt < :before
    """)
    int deleteOlderThan(@Param("before") Instant before);
}
