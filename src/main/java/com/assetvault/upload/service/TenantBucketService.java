package com.assetvault.upload.service;

import com.assetvault.upload.config.StorageProperties;
import com.assetvault.upload.entity.StorageBucket;
import com.assetvault.upload.exception.BucketNotReadyException;
import com.assetvault.upload.repo.StorageBucketRepository;
import com.assetvault.upload.storage.ObjectStoreGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the storage bucket a tenant uploads into.
 *
 * <p>Outside local environments buckets are provisioned asynchronously by another
 * process; until that finishes callers get a retryable {@link BucketNotReadyException}.
 * With {@code app.storage.auto-provision} the bucket is created synchronously.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantBucketService {

    private final StorageBucketRepository buckets;
    private final ObjectStoreGateway objectStore;
    private final StorageProperties storageProperties;

    @Transactional
    public StorageBucket resolve(UUID tenantId) {
        Optional<StorageBucket> existing = buckets.findByTenantId(tenantId);
        if (existing.isPresent()) {
            return requireActive(tenantId, existing.get());
        }
        if (!storageProperties.autoProvision()) {
            throw new BucketNotReadyException(tenantId, "bucket has not been provisioned");
        }
        return provision(tenantId);
    }

    private StorageBucket requireActive(UUID tenantId, StorageBucket bucket) {
        return switch (bucket.getStatus()) {
            case ACTIVE -> bucket;
            case PROVISIONING -> throw new BucketNotReadyException(tenantId,
                    "bucket is being provisioned, try again in a few moments");
            case FAILED -> throw new BucketNotReadyException(tenantId, "bucket provisioning failed");
        };
    }

    private StorageBucket provision(UUID tenantId) {
        String name = bucketName(tenantId);
        if (!objectStore.bucketExists(name)) {
            objectStore.createBucket(name);
        }
        StorageBucket bucket = new StorageBucket();
        bucket.setId(UUID.randomUUID());
        bucket.setTenantId(tenantId);
        bucket.setName(name);
        bucket.setStatus(StorageBucket.Status.ACTIVE);
        try {
            StorageBucket saved = buckets.saveAndFlush(bucket);
            log.info("Provisioned storage bucket for tenant={}: {}", tenantId, name);
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.info("Storage bucket for tenant={} was provisioned concurrently: {}", tenantId, name);
            throw new BucketNotReadyException(tenantId, "bucket is being provisioned, try again in a few moments");
        }
    }

    @Transactional(readOnly = true)
    public Optional<String> findBucketName(UUID storageBucketId) {
        return buckets.findById(storageBucketId).map(StorageBucket::getName);
    }

    String bucketName(UUID tenantId) {
        return storageProperties.bucketPrefix() + tenantId.toString().toLowerCase();
    }
}
