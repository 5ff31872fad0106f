package com.assetvault.upload.repo;

import com.assetvault.upload.entity.Asset;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface AssetRepository extends JpaRepository<Asset, UUID> {
    Optional<Asset> findByUploadSessionIdAndDeletedAtIsNull(UUID uploadSessionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Asset a where a.uploadSessionId = :uploadSessionId and a.deletedAt is null")
    Optional<Asset> lockByUploadSessionId(@Param("uploadSessionId") UUID uploadSessionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Asset a where a.id = :id and a.deletedAt is null")
    Optional<Asset> lockById(@Param("id") UUID id);

    Optional<Asset> findByIdAndTenantIdAndDeletedAtIsNull(UUID id, UUID tenantId);
}
