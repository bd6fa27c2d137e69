package com.modelmonitor.repository;

import com.modelmonitor.entity.Alert;
import com.modelmonitor.entity.AlertSeverity;
import com.modelmonitor.entity.AlertType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AlertRepository extends JpaRepository<Alert, UUID> {

    List<Alert> findByDismissedAtIsNullOrderByCreatedAtDesc();

    List<Alert> findByModelKeyOrderByCreatedAtDesc(String modelKey);

    long countByModelKeyAndType(String modelKey, AlertType type);

    long countByModelKeyAndSeverity(String modelKey, AlertSeverity severity);
}
