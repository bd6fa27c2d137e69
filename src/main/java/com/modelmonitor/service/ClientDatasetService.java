package com.modelmonitor.service;

import com.modelmonitor.entity.ClientDataset;
import com.modelmonitor.entity.DatasetStatus;
import com.modelmonitor.repository.ClientDatasetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Accumulating client data per model. {@code datasetVersion} increases by one per recorded
 * dataset; status moves ACTIVE → PROCESSING while a retraining consumes it, then to ARCHIVED, or
 * back to ACTIVE if the attempt failed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientDatasetService {

    private final ClientDatasetRepository repository;
    private final Clock clock;

    @Transactional
    public ClientDataset record(String modelKey, long itemCount, double confidenceThreshold) {
        if (itemCount < 0) {
            throw new IllegalArgumentException("itemCount must be >= 0");
        }
        long next = repository.findTopByModelKeyOrderByDatasetVersionDesc(modelKey)
            .map(d -> d.getDatasetVersion() + 1)
            .orElse(1L);
        ClientDataset saved = repository.saveAndFlush(ClientDataset.builder()
            .modelKey(modelKey)
            .datasetVersion(next)
            .itemCount(itemCount)
            .confidenceThreshold(confidenceThreshold)
            .status(DatasetStatus.ACTIVE)
            .createdAt(clock.instant())
            .build());
        log.info("Client dataset recorded | model={} | datasetVersion={} | items={}", modelKey, next, itemCount);
        return saved;
    }

    public List<ClientDataset> pending(String modelKey) {
        return repository.findByModelKeyAndStatusOrderByDatasetVersionAsc(modelKey, DatasetStatus.ACTIVE);
    }

    public long pendingItems(String modelKey) {
        return repository.sumItemCount(modelKey, DatasetStatus.ACTIVE);
    }

    /** Must run inside the caller's transaction. */
    public void markProcessing(List<ClientDataset> datasets, UUID jobId) {
        datasets.forEach(d -> {
            d.setStatus(DatasetStatus.PROCESSING);
            d.setRetrainingJobId(jobId);
        });
        repository.saveAll(datasets);
    }

    public void markArchived(UUID jobId) {
        transition(jobId, DatasetStatus.ARCHIVED);
    }

    public void restoreActive(UUID jobId) {
        List<ClientDataset> datasets = repository.findByRetrainingJobId(jobId);
        datasets.forEach(d -> {
            d.setStatus(DatasetStatus.ACTIVE);
            d.setRetrainingJobId(null);
        });
        repository.saveAll(datasets);
    }

    private void transition(UUID jobId, DatasetStatus status) {
        List<ClientDataset> datasets = repository.findByRetrainingJobId(jobId);
        datasets.forEach(d -> d.setStatus(status));
        repository.saveAll(datasets);
    }
}
