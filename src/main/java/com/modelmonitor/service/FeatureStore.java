package com.modelmonitor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.modelmonitor.config.LifecycleProperties;
import com.modelmonitor.dto.DistributionSample;
import com.modelmonitor.dto.FeatureSnapshotMetadata;
import com.modelmonitor.dto.FeatureSpec;
import com.modelmonitor.dto.FeatureTransformers;
import com.modelmonitor.entity.FeatureSnapshot;
import com.modelmonitor.exception.FeatureSnapshotConflictException;
import com.modelmonitor.exception.FeatureSnapshotNotFoundException;
import com.modelmonitor.repository.FeatureSnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Versioned, per-model store of fitted feature transformers.
 *
 * <p>Snapshots are content-addressed by the SHA-256 of their canonical JSON and are never
 * updated once written. Loaded snapshots are kept in a bounded cache that evicts the least
 * recently read entry; cache reads take no lock.
 */
@Slf4j
@Service
public class FeatureStore {

    private final FeatureSnapshotRepository repository;
    private final ObjectMapper mapper;
    private final ObjectMapper canonicalMapper;
    private final int maxCached;
    private final TransactionTemplate freshRead;

    private final ConcurrentHashMap<SnapshotKey, CachedSnapshot> cache = new ConcurrentHashMap<>();
    private final AtomicLong accessSequence = new AtomicLong();

    public FeatureStore(FeatureSnapshotRepository repository, ObjectMapper mapper, LifecycleProperties properties,
                        PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.mapper = mapper;
        this.canonicalMapper = mapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.maxCached = properties.getFeatureStore().getCacheSize();
        // The writer's own session is unusable after a failed insert, so the winner is read in a new one.
        this.freshRead = new TransactionTemplate(transactionManager);
        this.freshRead.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.freshRead.setReadOnly(true);
    }

    /**
     * Stores the transformers of {@code modelKey}/{@code version}. Re-saving identical content is
     * a no-op; different content for an existing version is rejected. Two writers racing on the
     * same version are settled by the unique key: the loser compares its content with the row
     * that won.
     */
    public FeatureSnapshotMetadata save(String modelKey, String version, FeatureTransformers transformers) {
        if (transformers == null) {
            throw new IllegalArgumentException("transformers must not be null");
        }
        String payload = canonicalJson(transformers);
        String hash = sha256(payload);

        Optional<FeatureSnapshot> existing = repository.findByModelKeyAndVersion(modelKey, version);
        if (existing.isPresent()) {
            FeatureSnapshot snapshot = existing.get();
            if (!snapshot.getContentHash().equals(hash)) {
                throw new FeatureSnapshotConflictException(modelKey, version, snapshot.getContentHash(), hash);
            }
            log.debug("Feature snapshot unchanged | model={} | version={} | hash={}", modelKey, version, hash);
            return toMetadata(snapshot, transformers);
        }

        FeatureSnapshot saved;
        try {
            saved = repository.saveAndFlush(FeatureSnapshot.builder()
                .modelKey(modelKey)
                .version(version)
                .contentHash(hash)
                .payload(payload)
                .build());
        } catch (DataIntegrityViolationException ex) {
            FeatureSnapshot winner = freshRead.execute(status -> repository.findByModelKeyAndVersion(modelKey, version))
                .orElseThrow(() -> ex);
            if (!winner.getContentHash().equals(hash)) {
                log.warn("Feature snapshot lost concurrent write | model={} | version={} | existingHash={} | newHash={}",
                         modelKey, version, winner.getContentHash(), hash);
                throw new FeatureSnapshotConflictException(modelKey, version, winner.getContentHash(), hash);
            }
            log.debug("Feature snapshot written concurrently with same content | model={} | version={}", modelKey, version);
            return toMetadata(winner, transformers);
        }
        log.info("Feature snapshot saved | model={} | version={} | features={} | hash={}",
                 modelKey, version, transformers.features().size(), hash);
        return toMetadata(saved, transformers);
    }

    public FeatureTransformers load(String modelKey, String version) {
        SnapshotKey key = new SnapshotKey(modelKey, version);
        CachedSnapshot cached = cache.get(key);
        if (cached != null) {
            cached.touch(accessSequence.incrementAndGet());
            return cached.transformers();
        }

        FeatureSnapshot snapshot = repository.findByModelKeyAndVersion(modelKey, version)
            .orElseThrow(() -> new FeatureSnapshotNotFoundException(modelKey, version));
        FeatureTransformers transformers = parse(snapshot);
        cache.putIfAbsent(key, new CachedSnapshot(transformers, snapshot.getContentHash(),
            new AtomicLong(accessSequence.incrementAndGet())));
        evictIfNeeded();
        return transformers;
    }

    /**
     * Feature names, types, content hash and creation time. Reads storage directly and leaves the
     * cache untouched.
     */
    public FeatureSnapshotMetadata metadata(String modelKey, String version) {
        FeatureSnapshot snapshot = repository.findByModelKeyAndVersion(modelKey, version)
            .orElseThrow(() -> new FeatureSnapshotNotFoundException(modelKey, version));
        return toMetadata(snapshot, parse(snapshot));
    }

    public Optional<DistributionSample> baseline(String modelKey, String version) {
        return Optional.ofNullable(load(modelKey, version).baseline());
    }

    public String contentHash(FeatureTransformers transformers) {
        return sha256(canonicalJson(transformers));
    }

    int cachedEntries() {
        return cache.size();
    }

    boolean isCached(String modelKey, String version) {
        return cache.containsKey(new SnapshotKey(modelKey, version));
    }

    private void evictIfNeeded() {
        int overflow = cache.size() - maxCached;
        if (overflow <= 0) {
            return;
        }
        cache.entrySet().stream()
            .sorted(Comparator.comparingLong(e -> e.getValue().lastAccess().get()))
            .limit(overflow)
            .map(Map.Entry::getKey)
            .toList()
            .forEach(k -> {
                cache.remove(k);
                log.debug("Feature snapshot evicted | model={} | version={}", k.modelKey(), k.version());
            });
    }

    private FeatureTransformers parse(FeatureSnapshot snapshot) {
        try {
            return mapper.readValue(snapshot.getPayload(), FeatureTransformers.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt feature snapshot " + snapshot.getModelKey()
                + "/" + snapshot.getVersion(), e);
        }
    }

    String canonicalJson(FeatureTransformers transformers) {
        try {
            // Through a plain map tree so that every nested object is written with sorted keys.
            Object tree = canonicalMapper.convertValue(transformers, Object.class);
            return canonicalMapper.writeValueAsString(tree);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Cannot serialise feature transformers", e);
        }
    }

    private static String sha256(String payload) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private FeatureSnapshotMetadata toMetadata(FeatureSnapshot snapshot, FeatureTransformers transformers) {
        return FeatureSnapshotMetadata.builder()
            .modelKey(snapshot.getModelKey())
            .version(snapshot.getVersion())
            .featureNames(transformers.featureNames())
            .featureTypes(transformers.features().stream().map(FeatureSpec::type).toList())
            .contentHash(snapshot.getContentHash())
            .createdAt(snapshot.getCreatedAt())
            .build();
    }

    private record SnapshotKey(String modelKey, String version) {}

    private record CachedSnapshot(FeatureTransformers transformers, String contentHash, AtomicLong lastAccess) {
        private void touch(long sequence) {
            lastAccess.set(sequence);
        }
    }
}
