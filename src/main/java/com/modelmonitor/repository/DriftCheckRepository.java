package com.modelmonitor.repository;

import com.modelmonitor.entity.DriftCheck;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DriftCheckRepository extends JpaRepository<DriftCheck, UUID> {

    boolean existsByModelKeyAndCheckDate(String modelKey, LocalDate checkDate);

    Optional<DriftCheck> findByModelKeyAndCheckDate(String modelKey, LocalDate checkDate);

    List<DriftCheck> findByModelKeyOrderByCheckDateDesc(String modelKey, Pageable pageable);

    long countByModelKey(String modelKey);
}
