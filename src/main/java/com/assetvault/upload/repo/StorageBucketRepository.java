package com.assetvault.upload.repo;

import com.assetvault.upload.entity.StorageBucket;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface StorageBucketRepository extends JpaRepository<StorageBucket, UUID> {
    Optional<StorageBucket> findByTenantId(UUID tenantId);
}
