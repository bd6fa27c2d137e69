package com.modelmonitor.repository;

import com.modelmonitor.entity.ManagedModel;
import com.modelmonitor.entity.ModelStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ManagedModelRepository extends JpaRepository<ManagedModel, String> {

    List<ManagedModel> findByStatusOrderByModelKeyAsc(ModelStatus status);

    /**
     * Compare-and-swap of the active pointer on promotion. Returns 0 when the pointer no longer
     * equals {@code expected}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ManagedModel m
           SET m.activeVersion = :next,
               m.accuracy      = :accuracy,
               m.lastTrained   = :at,
               m.updatedAt     = :at
         WHERE m.modelKey      = :modelKey
           AND m.activeVersion = :expected
    """)
    int promoteActiveVersion(
        @Param("modelKey") String modelKey,
        @Param("expected") String expected,
        @Param("next")     String next,
        @Param("accuracy") Double accuracy,
        @Param("at")       Instant at
    );

    /**
     * Compare-and-swap of the active pointer on rollback; {@code lastTrained} is left alone.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ManagedModel m
           SET m.activeVersion = :previous,
               m.accuracy      = :accuracy,
               m.updatedAt     = :at
         WHERE m.modelKey      = :modelKey
           AND m.activeVersion = :expected
    """)
    int restoreActiveVersion(
        @Param("modelKey") String modelKey,
        @Param("expected") String expected,
        @Param("previous") String previous,
        @Param("accuracy") Double accuracy,
        @Param("at")       Instant at
    );
}
